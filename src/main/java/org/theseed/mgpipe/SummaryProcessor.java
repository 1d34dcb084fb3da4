/**
 *
 */
package org.theseed.mgpipe;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.EnumMap;
import java.util.Map;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.community.Compartment;
import org.theseed.community.MetaModel;
import org.theseed.community.Reaction;
import org.theseed.community.ReactionRole;

/**
 * This command summarizes the structure of a metabolic model.  It lists the number of
 * metabolites in each compartment and the number of reactions in each role.  Optionally, the
 * reactions in a single role can be listed with their bounds and formulas.
 *
 * The positional parameter is the name of the model JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --role	if specified, a reaction role whose reactions should be listed
 */
public class SummaryProcessor extends BaseModelProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SummaryProcessor.class);
    /** output stream for the report */
    private OutputStream outStream;

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, usage = "output file for report (if not STDOUT)")
    private File outFile;

    /** role of reactions to list */
    @Option(name = "--role", metaVar = "FECAL_EXCHANGE", usage = "if specified, role of reactions to list")
    private ReactionRole role;

    @Override
    protected void setModelDefaults() {
        this.outFile = null;
        this.role = null;
    }

    @Override
    protected void validateModelParms() throws IOException, ParseFailureException {
        if (this.outFile == null) {
            log.info("Summary will be written to the standard output.");
            this.outStream = System.out;
        } else {
            log.info("Summary will be written to {}.", this.outFile);
            this.outStream = new FileOutputStream(this.outFile);
        }
    }

    @Override
    protected void runCommand() throws Exception {
        try (PrintWriter writer = new PrintWriter(this.outStream)) {
            this.writeSummary(writer);
        }
    }

    /**
     * Write the model summary.
     *
     * @param writer	print writer to receive the summary
     */
    private void writeSummary(PrintWriter writer) {
        MetaModel model = this.getModel();
        writer.println("category\ttype\tcount");
        Map<Compartment, Integer> metCounts = new EnumMap<Compartment, Integer>(Compartment.class);
        for (String metId : model.getMetabolites())
            metCounts.merge(Compartment.of(metId), 1, Integer::sum);
        for (Map.Entry<Compartment, Integer> entry : metCounts.entrySet())
            writer.println("metabolites\t" + entry.getKey() + "\t" + entry.getValue());
        Map<ReactionRole, Integer> rxnCounts = new EnumMap<ReactionRole, Integer>(ReactionRole.class);
        for (Reaction reaction : model.getReactions())
            rxnCounts.merge(reaction.getRole(), 1, Integer::sum);
        for (Map.Entry<ReactionRole, Integer> entry : rxnCounts.entrySet())
            writer.println("reactions\t" + entry.getKey() + "\t" + entry.getValue());
        log.info("{} compartments and {} reaction roles found.", metCounts.size(), rxnCounts.size());
        if (this.role != null) {
            writer.println();
            writer.println("reaction_id\tlower\tupper\tformula");
            for (Reaction reaction : model.getReactions(this.role))
                writer.println(reaction.getId() + "\t" + reaction.getLowerBound() + "\t" + reaction.getUpperBound()
                        + "\t" + reaction.getFormula());
        }
    }

}
