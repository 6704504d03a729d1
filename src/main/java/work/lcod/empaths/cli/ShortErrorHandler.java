package work.lcod.empaths.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Keeps CLI failures short and focused on the root cause; the stack trace goes to the debug log.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ShortErrorHandler.class);

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        LOG.debug("Command failed", ex);
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
