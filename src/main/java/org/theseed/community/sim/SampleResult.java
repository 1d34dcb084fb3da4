/**
 *
 */
package org.theseed.community.sim;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object contains the scenario results for one sample.
 */
public class SampleResult {

    // FIELDS
    /** ID of the sample */
    private String sampleId;
    /** results by scenario */
    private Map<Scenario, ScenarioResult> results;

    /**
     * Construct an empty sample result.
     *
     * @param sampleId	ID of the sample
     */
    public SampleResult(String sampleId) {
        this.sampleId = sampleId;
        this.results = new EnumMap<Scenario, ScenarioResult>(Scenario.class);
    }

    /**
     * Construct a sample result from a JSON object.
     *
     * @param sampleId	ID of the sample
     * @param json		JSON object mapping scenario names to results
     */
    public SampleResult(String sampleId, JsonObject json) {
        this(sampleId);
        for (Scenario scenario : Scenario.values()) {
            Object scenarioJson = json.get(scenario.name());
            if (scenarioJson != null)
                this.results.put(scenario, new ScenarioResult((JsonObject) scenarioJson));
        }
    }

    /**
     * @return a JSON object for this sample's results
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        for (Map.Entry<Scenario, ScenarioResult> entry : this.results.entrySet())
            retVal.put(entry.getKey().name(), entry.getValue().toJson());
        return retVal;
    }

    /**
     * Store the result for a scenario.
     *
     * @param scenario		scenario simulated
     * @param result		result of the simulation
     */
    public void put(Scenario scenario, ScenarioResult result) {
        this.results.put(scenario, result);
    }

    /**
     * @return the result for a scenario, or NULL if it has not been simulated
     *
     * @param scenario		scenario of interest
     */
    public ScenarioResult get(Scenario scenario) {
        return this.results.get(scenario);
    }

    /**
     * @return TRUE if every one of the specified scenarios has a valid result
     *
     * @param scenarios		scenarios that must be present
     * @param profiles		TRUE if flux profiles were requested
     */
    public boolean isValid(Collection<Scenario> scenarios, boolean profiles) {
        boolean retVal = true;
        for (Scenario scenario : scenarios) {
            ScenarioResult result = this.results.get(scenario);
            if (result == null || ! result.isValid(profiles))
                retVal = false;
        }
        return retVal;
    }

    /**
     * @return the ID of the sample
     */
    public String getSampleId() {
        return this.sampleId;
    }

    /**
     * @return the map of scenarios to results
     */
    public Map<Scenario, ScenarioResult> getResults() {
        return Collections.unmodifiableMap(this.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.sampleId, this.results);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof SampleResult))
            return false;
        SampleResult other = (SampleResult) obj;
        return this.sampleId.equals(other.sampleId) && this.results.equals(other.results);
    }

    @Override
    public String toString() {
        return "Sample " + this.sampleId + " " + this.results;
    }

}
