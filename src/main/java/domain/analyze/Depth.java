package domain.analyze;

/**
 * (SQL nesting, template nesting) pair. Ordered lexicographically, SQL depth first.
 */
public final class Depth implements Comparable<Depth> {

    public static final Depth ZERO = new Depth(0, 0);

    private final int sql;
    private final int jinja;

    public Depth(int sql, int jinja) {
        this.sql = sql;
        this.jinja = jinja;
    }

    public int getSql() {
        return sql;
    }

    public int getJinja() {
        return jinja;
    }

    /** Four spaces per level of either kind. */
    public int indentSize() {
        return 4 * (sql + jinja);
    }

    @Override
    public int compareTo(Depth o) {
        if (sql != o.sql) return Integer.compare(sql, o.sql);
        return Integer.compare(jinja, o.jinja);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Depth)) return false;
        Depth that = (Depth) o;
        return sql == that.sql && jinja == that.jinja;
    }

    @Override
    public int hashCode() {
        return 31 * sql + jinja;
    }

    @Override
    public String toString() {
        return "(" + sql + ", " + jinja + ")";
    }
}
