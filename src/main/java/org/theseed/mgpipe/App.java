package org.theseed.mgpipe;

import java.util.Arrays;

/**
 * Commands for building and simulating microbial community models.
 *
 * build		assemble a community model for each sample in an abundance table
 * simulate		run the resumable diet simulations for a batch of samples
 * summary		summarize the compartments and reaction roles of a model
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("A command is required:  build, simulate, or summary.");
            System.exit(1);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "build" :
            processor = new BuildProcessor();
            break;
        case "simulate" :
            processor = new SimulateProcessor();
            break;
        case "summary" :
            processor = new SummaryProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
        if (processor.isFailed())
            System.exit(1);
    }
}
