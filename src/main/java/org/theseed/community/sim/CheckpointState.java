/**
 *
 */
package org.theseed.community.sim;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object contains the state of a simulation batch:  the index of the last sample completed
 * and the results for every sample simulated so far.  The objective table ("presol") and the
 * infeasibility registry ("inFesMat") are computed from the sample results.
 */
public class CheckpointState {

    // FIELDS
    /** index of the last sample completed (-1 if none) */
    private int lastCompletedSampleIndex;
    /** results by sample ID */
    private Map<String, SampleResult> samples;

    private static enum StateKeys implements JsonKey {
        LAST_COMPLETED_SAMPLE_INDEX(-1), SAMPLES(null), PRESOL(null), IN_FES_MAT(null);

        private final Object m_value;

        private StateKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            String retVal;
            switch (this) {
            case LAST_COMPLETED_SAMPLE_INDEX :
                retVal = "lastCompletedSampleIndex";
                break;
            case IN_FES_MAT :
                retVal = "inFesMat";
                break;
            default :
                retVal = this.name().toLowerCase();
            }
            return retVal;
        }

        /** This is the default value used when the key is not found.
         */
        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * Construct an empty checkpoint state.
     */
    public CheckpointState() {
        this.lastCompletedSampleIndex = -1;
        this.samples = new LinkedHashMap<String, SampleResult>();
    }

    /**
     * Construct a checkpoint state from a JSON object.  The derived tables are ignored.
     *
     * @param json		JSON object containing the state
     */
    public CheckpointState(JsonObject json) {
        this();
        this.lastCompletedSampleIndex = json.getIntegerOrDefault(StateKeys.LAST_COMPLETED_SAMPLE_INDEX);
        Map<String, Object> sampleMap = json.getMapOrDefault(StateKeys.SAMPLES);
        if (sampleMap != null) {
            for (Map.Entry<String, Object> entry : sampleMap.entrySet())
                this.samples.put(entry.getKey(), new SampleResult(entry.getKey(), (JsonObject) entry.getValue()));
        }
    }

    /**
     * @return a JSON object for this state, including the derived tables
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(StateKeys.LAST_COMPLETED_SAMPLE_INDEX.getKey(), this.lastCompletedSampleIndex);
        JsonObject sampleMap = new JsonObject();
        for (SampleResult sample : this.samples.values())
            sampleMap.put(sample.getSampleId(), sample.toJson());
        retVal.put(StateKeys.SAMPLES.getKey(), sampleMap);
        JsonObject presolMap = new JsonObject();
        for (Map.Entry<String, Map<Scenario, Double>> entry : this.getPresol().entrySet()) {
            JsonObject objectives = new JsonObject();
            for (Map.Entry<Scenario, Double> objective : entry.getValue().entrySet())
                objectives.put(objective.getKey().name(), ExchangeFlux.toJson(objective.getValue()));
            presolMap.put(entry.getKey(), objectives);
        }
        retVal.put(StateKeys.PRESOL.getKey(), presolMap);
        JsonObject infeasibleMap = new JsonObject();
        for (Map.Entry<String, List<Scenario>> entry : this.getInfeasible().entrySet()) {
            JsonArray scenarios = new JsonArray();
            for (Scenario scenario : entry.getValue())
                scenarios.add(scenario.name());
            infeasibleMap.put(entry.getKey(), scenarios);
        }
        retVal.put(StateKeys.IN_FES_MAT.getKey(), infeasibleMap);
        return retVal;
    }

    /**
     * Store the results for a sample and record it as the last one completed.
     *
     * @param index		index of the sample in the batch
     * @param result	results for the sample
     */
    public void complete(int index, SampleResult result) {
        this.samples.put(result.getSampleId(), result);
        this.lastCompletedSampleIndex = Math.max(this.lastCompletedSampleIndex, index);
    }

    /**
     * @return the results for a sample, or NULL if it has not been simulated
     *
     * @param sampleId	ID of the sample of interest
     */
    public SampleResult get(String sampleId) {
        return this.samples.get(sampleId);
    }

    /**
     * @return the results for all samples simulated
     */
    public Collection<SampleResult> getSamples() {
        return Collections.unmodifiableCollection(this.samples.values());
    }

    /**
     * @return the index of the last sample completed (-1 if none)
     */
    public int getLastCompletedSampleIndex() {
        return this.lastCompletedSampleIndex;
    }

    /**
     * @return a map of sample IDs to the objective value for each feasible scenario
     */
    public Map<String, Map<Scenario, Double>> getPresol() {
        Map<String, Map<Scenario, Double>> retVal = new LinkedHashMap<String, Map<Scenario, Double>>();
        for (SampleResult sample : this.samples.values()) {
            Map<Scenario, Double> objectives = new EnumMap<Scenario, Double>(Scenario.class);
            for (Map.Entry<Scenario, ScenarioResult> entry : sample.getResults().entrySet()) {
                if (entry.getValue().isFeasible())
                    objectives.put(entry.getKey(), entry.getValue().getObjective());
            }
            retVal.put(sample.getSampleId(), objectives);
        }
        return retVal;
    }

    /**
     * @return a map of sample IDs to the scenarios found infeasible (only samples with at least one)
     */
    public Map<String, List<Scenario>> getInfeasible() {
        Map<String, List<Scenario>> retVal = new LinkedHashMap<String, List<Scenario>>();
        for (SampleResult sample : this.samples.values()) {
            List<Scenario> scenarios = new ArrayList<Scenario>();
            for (Map.Entry<Scenario, ScenarioResult> entry : sample.getResults().entrySet()) {
                if (! entry.getValue().isFeasible())
                    scenarios.add(entry.getKey());
            }
            if (! scenarios.isEmpty())
                retVal.put(sample.getSampleId(), scenarios);
        }
        return retVal;
    }

    @Override
    public int hashCode() {
        return 31 * this.lastCompletedSampleIndex + this.samples.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof CheckpointState))
            return false;
        CheckpointState other = (CheckpointState) obj;
        return this.lastCompletedSampleIndex == other.lastCompletedSampleIndex && this.samples.equals(other.samples);
    }

}
