/**
 *
 */
package org.theseed.mgpipe;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.community.AbundanceTable;
import org.theseed.community.CommunityAssembler;
import org.theseed.community.JsonModelStore;
import org.theseed.community.MergeTreeScheduler;
import org.theseed.community.MetaModel;
import org.theseed.community.ModelStore;
import org.theseed.community.OrganismAdapter;

/**
 * This command assembles a community model for each sample in an abundance table.  The organism
 * models are read from a model directory, adapted to the community namespace, and merged.  If a
 * host model is specified, it is adapted and coupled to each community.
 *
 * The positional parameters are the name of the organism model directory, the name of the output
 * directory for the community models, and the name of the abundance file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --host			JSON file for the host model (if any)
 * --hostBiomass	ID of the host biomass reaction (required with --host)
 * --objective		ID of the organism biomass objective reaction (default "EX_biomass(e)")
 * --strategy		merge strategy (default AUTO)
 * --threshold		organism count above which AUTO merges sequentially (default 500)
 * --workers		number of parallel merges within a merge-tree level (default 1)
 * --repeat			rebuild community models that already exist
 */
public class BuildProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BuildProcessor.class);
    /** abundance table */
    private AbundanceTable abundances;
    /** organism model store */
    private ModelStore organismStore;
    /** community model store */
    private ModelStore communityStore;
    /** community assembler */
    private CommunityAssembler assembler;

    // COMMAND-LINE OPTIONS

    /** host model file */
    @Option(name = "--host", metaVar = "host.json", usage = "JSON file for host model (if any)")
    private File hostFile;

    /** host biomass reaction */
    @Option(name = "--hostBiomass", metaVar = "biomass_reaction", usage = "ID of the host biomass reaction")
    private String hostBiomass;

    /** organism objective reaction */
    @Option(name = "--objective", metaVar = "EX_biomass(e)", usage = "ID of the organism biomass objective reaction")
    private String objective;

    /** merge strategy */
    @Option(name = "--strategy", usage = "organism model merge strategy")
    private MergeTreeScheduler.Strategy strategy;

    /** sequential threshold */
    @Option(name = "--threshold", metaVar = "500", usage = "organism count above which AUTO strategy merges sequentially")
    private int threshold;

    /** number of parallel merges */
    @Option(name = "--workers", metaVar = "4", usage = "number of parallel merges within a merge-tree level")
    private int workers;

    /** TRUE to rebuild existing models */
    @Option(name = "--repeat", usage = "if specified, existing community models will be rebuilt")
    private boolean repeat;

    /** organism model directory */
    @Argument(index = 0, metaVar = "modelDir", usage = "directory of organism model JSON files", required = true)
    private File modelDir;

    /** community model output directory */
    @Argument(index = 1, metaVar = "outDir", usage = "output directory for community models", required = true)
    private File outDir;

    /** abundance file */
    @Argument(index = 2, metaVar = "abundance.tbl", usage = "tab-delimited organism abundance file", required = true)
    private File abundanceFile;

    @Override
    protected void setDefaults() {
        this.hostFile = null;
        this.hostBiomass = null;
        this.objective = "EX_biomass(e)";
        this.strategy = MergeTreeScheduler.Strategy.AUTO;
        this.threshold = MergeTreeScheduler.DEFAULT_THRESHOLD;
        this.workers = 1;
        this.repeat = false;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (! this.modelDir.isDirectory())
            throw new FileNotFoundException("Model directory " + this.modelDir + " is not found or invalid.");
        if (! this.abundanceFile.canRead())
            throw new FileNotFoundException("Abundance file " + this.abundanceFile + " is not found or unreadable.");
        if (this.workers < 1)
            throw new ParseFailureException("Worker count must be at least 1.");
        if (this.threshold < 1)
            throw new ParseFailureException("Sequential threshold must be at least 1.");
        MetaModel rawHost = null;
        if (this.hostFile != null) {
            if (this.hostBiomass == null)
                throw new ParseFailureException("A host biomass reaction is required when a host model is specified.");
            if (! this.hostFile.canRead())
                throw new FileNotFoundException("Host model file " + this.hostFile + " is not found or unreadable.");
            rawHost = JsonModelStore.read(this.hostFile);
            if (! rawHost.hasReaction(this.hostBiomass))
                throw new ParseFailureException("Host biomass reaction " + this.hostBiomass + " is not in the host model.");
        }
        this.abundances = new AbundanceTable(this.abundanceFile);
        log.info("{} samples found in {}.", this.abundances.getSamples().size(), this.abundanceFile);
        if (! this.outDir.isDirectory()) {
            log.info("Creating output directory {}.", this.outDir);
            FileUtils.forceMkdir(this.outDir);
        }
        this.organismStore = new JsonModelStore(this.modelDir);
        this.communityStore = new JsonModelStore(this.outDir);
        MergeTreeScheduler scheduler = new MergeTreeScheduler(this.strategy, this.threshold, this.workers);
        this.assembler = new CommunityAssembler(scheduler, this.objective, rawHost);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        List<String> samples = this.abundances.getSamples();
        int built = 0;
        for (String sampleId : samples) {
            String name = ModelStore.communityName(sampleId, this.assembler.hasHost());
            if (! this.repeat && this.communityStore.contains(name))
                log.info("Community model {} already exists.", name);
            else {
                Map<String, Double> sampleAbundances = this.abundances.getAbundances(sampleId);
                if (sampleAbundances.isEmpty())
                    log.warn("Sample {} has no organisms and will be skipped.", sampleId);
                else {
                    MetaModel community = this.assembler.assemble(sampleId, sampleAbundances,
                            x -> OrganismAdapter.adapt(this.organismStore.load(x), x, this.objective));
                    community.setName(name);
                    this.communityStore.save(name, community);
                    built++;
                }
            }
        }
        log.info("{} community models built for {} samples.", built, samples.size());
    }

}
