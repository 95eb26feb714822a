/**
 * Command-line entry points: the {@code blocklist} dispatcher and its {@code run} and {@code optimize} commands.
 * <p><strong>Conventions:</strong> options are {@code key=value} pairs, flags start with {@code --}, and each
 * command returns an {@link ca.gc.cra.blocklist.api.ExitCode}.</p>
 */
package ca.gc.cra.blocklist.api;
