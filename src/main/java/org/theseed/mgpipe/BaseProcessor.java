/**
 *
 */
package org.theseed.mgpipe;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for the command processors.  The subclass declares its parameters with
 * args4j annotations.  Parsing sets the defaults, parses the command line, and validates the
 * result; running executes the command and records whether it succeeded.
 *
 * The command-line options common to all commands are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** TRUE if the command failed */
    private boolean failed;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "display more frequent log messages")
    private boolean debug;

    /**
     * Parse the command line and validate the parameters.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, FALSE if it should not run
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.failed = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug) {
                    ch.qos.logback.classic.Logger root =
                            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    root.setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            this.failed = true;
        } catch (IOException e) {
            log.error("Error processing parameters: {}", e.toString());
            this.failed = true;
        }
        return retVal;
    }

    /**
     * Execute the command.  Failures are logged and recorded.
     */
    public void run() {
        try {
            long start = System.currentTimeMillis();
            this.runCommand();
            log.info("Command completed in {} seconds.", (System.currentTimeMillis() - start) / 1000);
        } catch (Exception e) {
            log.error("Command failed.", e);
            this.failed = true;
        }
    }

    /**
     * @return TRUE if parsing or execution failed
     */
    public boolean isFailed() {
        return this.failed;
    }

    /**
     * Set the parameter defaults.
     */
    protected abstract void setDefaults();

    /**
     * Validate the parameters after parsing.
     *
     * @return TRUE if the command should run, else FALSE
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Execute the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
