package io.prospekt.cli.commands;

import java.util.concurrent.Callable;

/// Minimal abstract base for all Prospekt CLI commands.
///
/// Owns the banner display and the {@link #call()} / {@link #execute()} contract.
/// Subclasses return a process exit code from {@link #execute()}.
///
/// ### Exit codes
/// - {@value #EXIT_OK}: the command did its work
/// - {@value #EXIT_FAILED}: the run failed or was cancelled
/// - {@value #EXIT_USAGE}: bad arguments or configuration
public abstract class ProspektCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final String[] BANNER = {
        "",
        "  ___  ___  ___  ___  ___  ___  _  _______",
        " | _ \\| _ \\/ _ \\/ __|| _ \\| __|| |/ /_   _|",
        " |  _/|   / (_) \\__ \\|  _/| _| | ' <  | |",
        " |_|  |_|_\\\\___/|___/|_|  |___||_|\\_\\ |_|",
        "",
        " Sales intelligence, one company at a time",
        ""
    };

    @Override
    public final Integer call() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        return execute();
    }

    /// Returns whether the banner is printed before {@link #execute()}.
    protected boolean showBanner() {
        return true;
    }

    protected abstract int execute();
}
