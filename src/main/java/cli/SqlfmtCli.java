package cli;

import app.SqlfmtCliApp;

/**
 * CLI entrypoint facade. The work happens in {@link SqlfmtCliApp}.
 */
public class SqlfmtCli {

    public static void main(String[] args) {
        System.exit(SqlfmtCliApp.run(args, System.in, System.out));
    }
}
