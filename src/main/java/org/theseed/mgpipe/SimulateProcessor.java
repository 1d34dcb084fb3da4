/**
 *
 */
package org.theseed.mgpipe;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.community.JsonModelStore;
import org.theseed.community.sim.CheckpointState;
import org.theseed.community.sim.CheckpointStore;
import org.theseed.community.sim.ConstraintPolicy;
import org.theseed.community.sim.DietTable;
import org.theseed.community.sim.PersonalizedDietTable;
import org.theseed.community.sim.PolicyParameters;
import org.theseed.community.sim.SimplexFluxVariability;
import org.theseed.community.sim.SimplexLpSolver;
import org.theseed.community.sim.SimulationConfig;
import org.theseed.community.sim.SimulationDriver;

/**
 * This command runs the diet simulations for a batch of samples.  The community models must
 * already have been built.  Results are checkpointed in the result directory, and an interrupted
 * batch resumes where it left off unless a repeat is requested.
 *
 * The positional parameters are the name of the community model directory, the name of the
 * result directory, the name of the diet file, and the IDs of the samples to simulate.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --hostBiomass	ID of the host biomass reaction, if the communities are host-coupled
 * --hostCap		upper bound for the host biomass reaction (default 1)
 * --workers		number of parallel flux variability workers (default 1)
 * --rich			also simulate the rich-diet scenario
 * --personal		file of personalized diets; enables the personalized scenario (unverified)
 * --save			save the constrained models in the result directory
 * --noProfiles		skip the exchange flux profiles
 * --humanMets		allow uptake of host-derived metabolites in the diet scenarios
 * --minBiomass		lower bound for community biomass (default 0.4)
 * --fraction		fraction of the optimum retained during flux variability (default 0.9999)
 * --maxIter		maximum number of simplex iterations per solve (default 100000)
 * --repeat			ignore saved results and simulate every sample
 */
public class SimulateProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SimulateProcessor.class);
    /** simulation driver */
    private SimulationDriver driver;

    // COMMAND-LINE OPTIONS

    /** host biomass reaction */
    @Option(name = "--hostBiomass", metaVar = "biomass_reaction", usage = "ID of the host biomass reaction (if host-coupled)")
    private String hostBiomass;

    /** host biomass cap */
    @Option(name = "--hostCap", metaVar = "1.0", usage = "upper bound for host biomass flux")
    private double hostCap;

    /** number of flux variability workers */
    @Option(name = "--workers", metaVar = "4", usage = "number of parallel flux variability workers")
    private int workers;

    /** TRUE to simulate the rich diet */
    @Option(name = "--rich", usage = "if specified, the rich-diet scenario will also be simulated")
    private boolean rich;

    /** personalized diet file */
    @Option(name = "--personal", metaVar = "pDiets.tbl", usage = "file of personalized diets (unverified scenario)")
    private File personalFile;

    /** TRUE to save constrained models */
    @Option(name = "--save", usage = "if specified, the constrained models will be saved")
    private boolean saveModels;

    /** TRUE to skip the flux profiles */
    @Option(name = "--noProfiles", usage = "if specified, exchange flux profiles will not be computed")
    private boolean noProfiles;

    /** TRUE to allow host-derived metabolites */
    @Option(name = "--humanMets", usage = "if specified, host-derived metabolites are available in the diet")
    private boolean humanMets;

    /** community biomass lower bound */
    @Option(name = "--minBiomass", metaVar = "0.4", usage = "lower bound for community biomass flux")
    private double minBiomass;

    /** flux variability optimum fraction */
    @Option(name = "--fraction", metaVar = "0.99", usage = "fraction of the optimum retained during flux variability")
    private double fraction;

    /** simplex iteration limit */
    @Option(name = "--maxIter", metaVar = "100000", usage = "maximum number of simplex iterations per solve")
    private int maxIter;

    /** TRUE to ignore saved results */
    @Option(name = "--repeat", usage = "if specified, saved results will be ignored")
    private boolean repeat;

    /** community model directory */
    @Argument(index = 0, metaVar = "modelDir", usage = "directory of community model JSON files", required = true)
    private File modelDir;

    /** result directory */
    @Argument(index = 1, metaVar = "resultDir", usage = "directory for simulation results", required = true)
    private File resultDir;

    /** standard diet file */
    @Argument(index = 2, metaVar = "diet.tbl", usage = "tab-delimited standard diet file", required = true)
    private File dietFile;

    /** IDs of samples to simulate */
    @Argument(index = 3, metaVar = "sample1 sample2 ...", usage = "IDs of samples to simulate", required = true)
    private List<String> samples;

    @Override
    protected void setDefaults() {
        this.hostBiomass = null;
        this.hostCap = PolicyParameters.DEFAULT_HOST_CAP;
        this.workers = 1;
        this.rich = false;
        this.personalFile = null;
        this.saveModels = false;
        this.noProfiles = false;
        this.humanMets = false;
        this.minBiomass = PolicyParameters.DEFAULT_LOWER_BIOMASS;
        this.fraction = SimplexFluxVariability.DEFAULT_FRACTION;
        this.maxIter = SimplexLpSolver.DEFAULT_MAX_ITER;
        this.repeat = false;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (! this.modelDir.isDirectory())
            throw new FileNotFoundException("Model directory " + this.modelDir + " is not found or invalid.");
        if (! this.dietFile.canRead())
            throw new FileNotFoundException("Diet file " + this.dietFile + " is not found or unreadable.");
        if (this.workers < 1)
            throw new ParseFailureException("Worker count must be at least 1.");
        if (this.fraction <= 0.0 || this.fraction > 1.0)
            throw new ParseFailureException("Optimum fraction must be greater than 0 and no more than 1.");
        if (this.maxIter < 1)
            throw new ParseFailureException("Iteration limit must be at least 1.");
        if (this.hostCap <= 0.0)
            throw new ParseFailureException("Host biomass cap must be positive.");
        if (! this.resultDir.isDirectory()) {
            log.info("Creating result directory {}.", this.resultDir);
            FileUtils.forceMkdir(this.resultDir);
        }
        DietTable diet = new DietTable(this.dietFile);
        log.info("{} diet constraints read from {}.", diet.size(), this.dietFile);
        PersonalizedDietTable personalDiets = null;
        if (this.personalFile != null) {
            if (! this.personalFile.canRead())
                throw new FileNotFoundException("Personalized diet file " + this.personalFile + " is not found or unreadable.");
            personalDiets = new PersonalizedDietTable(this.personalFile);
        }
        SimulationConfig config = new SimulationConfig().setDiet(diet).setPersonalDiets(personalDiets)
                .setRich(this.rich).setSaveModels(this.saveModels).setProfiles(! this.noProfiles)
                .setRepeat(this.repeat);
        PolicyParameters parms = new PolicyParameters().setHostBiomassReaction(this.hostBiomass)
                .setHostBiomassCap(this.hostCap).setIncludeHumanMets(this.humanMets)
                .setLowerBiomassBound(this.minBiomass);
        SimplexLpSolver solver = new SimplexLpSolver(this.maxIter);
        this.driver = new SimulationDriver(config, new JsonModelStore(this.modelDir), new JsonModelStore(this.resultDir),
                new CheckpointStore(this.resultDir), solver, new SimplexFluxVariability(solver, this.fraction, this.workers),
                new ConstraintPolicy(parms));
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        CheckpointState state = this.driver.run(this.samples);
        int infeasible = state.getInfeasible().size();
        log.info("{} samples simulated. {} had at least one infeasible scenario.", state.getSamples().size(), infeasible);
    }

}
