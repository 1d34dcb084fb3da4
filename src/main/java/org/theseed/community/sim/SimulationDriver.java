/**
 *
 */
package org.theseed.community.sim;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.community.CommunityAssembler;
import org.theseed.community.Compartment;
import org.theseed.community.MetaModel;
import org.theseed.community.ModelStore;
import org.theseed.community.Reaction;
import org.theseed.community.ReactionRole;

/**
 * This class runs the diet simulations for a batch of samples.  Each sample's community model is
 * constrained and solved under each configured scenario, and optionally its exchange flux ranges
 * are profiled.  An infeasible scenario is recorded and the batch continues.
 *
 * The results are checkpointed after every sample.  A batch restarted after an interruption
 * reuses each sample whose saved results are complete and recomputes the rest.
 */
public class SimulationDriver {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SimulationDriver.class);
    /** batch options */
    private SimulationConfig config;
    /** source of community models */
    private ModelStore inputStore;
    /** destination for constrained models */
    private ModelStore outputStore;
    /** checkpoint manager */
    private CheckpointStore checkpoints;
    /** LP solver */
    private LpSolver solver;
    /** flux variability analyzer */
    private FluxVariability fva;
    /** constraint policy */
    private ConstraintPolicy policy;

    /**
     * Construct a simulation driver.
     *
     * @param config		batch options
     * @param inputStore	source of community models
     * @param outputStore	destination for constrained models
     * @param checkpoints	checkpoint manager for the result directory
     * @param solver		LP solver
     * @param fva			flux variability analyzer
     * @param policy		constraint policy
     */
    public SimulationDriver(SimulationConfig config, ModelStore inputStore, ModelStore outputStore,
            CheckpointStore checkpoints, LpSolver solver, FluxVariability fva, ConstraintPolicy policy) {
        this.config = config;
        this.inputStore = inputStore;
        this.outputStore = outputStore;
        this.checkpoints = checkpoints;
        this.solver = solver;
        this.fva = fva;
        this.policy = policy;
        if (config.isPersonalized())
            log.warn("Personalized diet simulation is enabled.  This scenario has not been verified.");
    }

    /**
     * Simulate a batch of samples.
     *
     * @param samples	IDs of the samples to simulate, in order
     *
     * @return the final state of the batch
     *
     * @throws IOException
     */
    public CheckpointState run(List<String> samples) throws IOException {
        CheckpointState retVal;
        if (this.config.isRepeat()) {
            log.info("Repeat requested:  saved results will be ignored.");
            retVal = new CheckpointState();
        } else
            retVal = this.checkpoints.load();
        List<Scenario> scenarios = this.config.getScenarios();
        final int n = samples.size();
        int reused = 0;
        for (int i = 0; i < n; i++) {
            String sampleId = samples.get(i);
            SampleResult old = retVal.get(sampleId);
            if (old != null && old.isValid(scenarios, this.config.isProfiles())) {
                log.debug("Reusing saved results for sample {}.", sampleId);
                retVal.complete(i, old);
                reused++;
            } else {
                log.info("Simulating sample {} ({} of {}).", sampleId, i + 1, n);
                SampleResult result = this.simulate(sampleId, scenarios);
                retVal.complete(i, result);
                this.checkpoints.saveIntermediate(retVal);
            }
        }
        if (reused > 0)
            log.info("{} of {} samples reused from saved results.", reused, n);
        this.checkpoints.saveFinal(retVal);
        return retVal;
    }

    /**
     * Simulate all the scenarios for one sample.
     *
     * @param sampleId		ID of the sample to simulate
     * @param scenarios		scenarios to simulate
     *
     * @return the sample's results
     *
     * @throws IOException
     */
    protected SampleResult simulate(String sampleId, List<Scenario> scenarios) throws IOException {
        boolean host = this.policy.getParms().hasHost();
        MetaModel community = this.inputStore.load(ModelStore.communityName(sampleId, host));
        MetaModel base = this.policy.applyBase(community);
        Map<String, String> exchangePairs = exchangePairs(base);
        SampleResult retVal = new SampleResult(sampleId);
        for (Scenario scenario : scenarios) {
            MetaModel constrained = this.policy.applyScenario(base, scenario, this.getDiet(scenario, sampleId));
            SolveResult solution = this.solver.solve(new LpProblem(constrained));
            ScenarioResult result;
            if (! solution.isOptimal()) {
                log.warn("Sample {} is infeasible under the {} scenario ({}).", sampleId, scenario, solution.getStatus());
                result = ScenarioResult.infeasible();
            } else {
                result = ScenarioResult.feasible(solution.getObjectiveValue());
                log.info("Sample {} {} scenario objective is {}.", sampleId, scenario, solution.getObjectiveValue());
                if (this.config.isProfiles())
                    this.profile(constrained, exchangePairs, result);
                if (this.config.isSaveModels())
                    this.outputStore.save(scenario.modelName(sampleId), constrained);
                result.markComplete();
            }
            retVal.put(scenario, result);
        }
        return retVal;
    }

    /**
     * Compute the exchange flux profiles for a feasible constrained model.
     *
     * @param model				constrained model
     * @param exchangePairs		map of fecal exchange IDs to diet exchange IDs
     * @param result			scenario result to receive the profiles
     */
    private void profile(MetaModel model, Map<String, String> exchangePairs, ScenarioResult result) {
        Map<String, FluxRange> fecalRanges = this.fva.compute(model, exchangePairs.keySet());
        List<String> dietIds = new ArrayList<String>(exchangePairs.size());
        for (String dietId : exchangePairs.values()) {
            if (dietId != null)
                dietIds.add(dietId);
        }
        Map<String, FluxRange> dietRanges = this.fva.compute(model, dietIds);
        final FluxRange missing = new FluxRange(Double.NaN, Double.NaN);
        for (Map.Entry<String, String> pair : exchangePairs.entrySet()) {
            FluxRange fecal = fecalRanges.getOrDefault(pair.getKey(), missing);
            FluxRange diet = (pair.getValue() == null ? missing : dietRanges.getOrDefault(pair.getValue(), missing));
            result.putProfile(pair.getKey(), new ExchangeFlux(diet.getMin(), fecal.getMax()),
                    new ExchangeFlux(diet.getMax(), fecal.getMin()));
        }
        result.markProfiled();
    }

    /**
     * @return a map of fecal exchange IDs to the diet exchange IDs for the same metabolites
     *
     * The community biomass exchange is excluded.  A fecal exchange with no diet counterpart maps to NULL.
     *
     * @param model		base-constrained community model
     */
    public static Map<String, String> exchangePairs(MetaModel model) {
        Map<String, String> retVal = new LinkedHashMap<String, String>();
        for (Reaction reaction : model.getReactions(ReactionRole.FECAL_EXCHANGE)) {
            String fecalId = reaction.getId();
            if (! fecalId.equals(CommunityAssembler.COMMUNITY_OBJECTIVE)) {
                String dietId = DietTable.DIET_PREFIX + Compartment.DIET.convert(fecalId);
                if (! model.hasReaction(dietId))
                    dietId = null;
                retVal.put(fecalId, dietId);
            }
        }
        return retVal;
    }

    /**
     * @return the diet for a scenario
     *
     * @param scenario		scenario of interest
     * @param sampleId		ID of the sample being simulated
     */
    private DietTable getDiet(Scenario scenario, String sampleId) {
        DietTable retVal;
        switch (scenario) {
        case PERSONALIZED :
            retVal = this.config.getPersonalDiets().getDiet(sampleId);
            if (retVal == null) {
                log.warn("No personalized diet found for sample {}:  all diet exchanges will be closed.", sampleId);
                retVal = new DietTable();
            }
            break;
        case STANDARD :
            retVal = this.config.getDiet();
            break;
        default :
            retVal = new DietTable();
        }
        return retVal;
    }

}
