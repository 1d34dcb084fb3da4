/**
 *
 */
package org.theseed.community.sim;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object contains the outcome of simulating one sample under one dietary scenario.  It
 * carries an explicit completion marker, so that a result written before the scenario finished
 * can be recognized and recomputed.
 *
 * The net production table maps each fecal exchange to the minimum diet flux and the maximum
 * fecal flux; the net uptake table maps it to the maximum diet flux and the minimum fecal flux.
 */
public class ScenarioResult {

    // FIELDS
    /** optimal objective value (NaN if infeasible) */
    private double objective;
    /** TRUE if the constrained model was feasible */
    private boolean feasible;
    /** TRUE if all the scenario's computations finished */
    private boolean complete;
    /** TRUE if the flux profiles were computed (the tables may still be empty) */
    private boolean profiled;
    /** net production by fecal exchange ID */
    private Map<String, ExchangeFlux> netProduction;
    /** net uptake by fecal exchange ID */
    private Map<String, ExchangeFlux> netUptake;

    private static enum ResultKeys implements JsonKey {
        OBJECTIVE(null), FEASIBLE(false), COMPLETE(false), PROFILED(false), NET_PRODUCTION(null), NET_UPTAKE(null);

        private final Object m_value;

        private ResultKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            String retVal;
            switch (this) {
            case NET_PRODUCTION :
                retVal = "netProduction";
                break;
            case NET_UPTAKE :
                retVal = "netUptake";
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
     * Construct an incomplete result.
     */
    private ScenarioResult(double objective, boolean feasible) {
        this.objective = objective + 0.0;
        this.feasible = feasible;
        this.complete = false;
        this.profiled = false;
        this.netProduction = new LinkedHashMap<String, ExchangeFlux>();
        this.netUptake = new LinkedHashMap<String, ExchangeFlux>();
    }

    /**
     * @return a completed result for an infeasible scenario
     */
    public static ScenarioResult infeasible() {
        ScenarioResult retVal = new ScenarioResult(Double.NaN, false);
        retVal.complete = true;
        return retVal;
    }

    /**
     * @return an incomplete result for a feasible scenario
     *
     * @param objective		optimal objective value
     */
    public static ScenarioResult feasible(double objective) {
        return new ScenarioResult(objective, true);
    }

    /**
     * Construct a scenario result from a JSON object.
     *
     * @param json		JSON object containing the result
     */
    public ScenarioResult(JsonObject json) {
        this(ExchangeFlux.fromJson(json.get(ResultKeys.OBJECTIVE.getKey())), json.getBooleanOrDefault(ResultKeys.FEASIBLE));
        this.complete = json.getBooleanOrDefault(ResultKeys.COMPLETE);
        this.profiled = json.getBooleanOrDefault(ResultKeys.PROFILED);
        readTable(json.getMapOrDefault(ResultKeys.NET_PRODUCTION), this.netProduction);
        readTable(json.getMapOrDefault(ResultKeys.NET_UPTAKE), this.netUptake);
    }

    /**
     * Fill a profile table from a JSON map.
     *
     * @param jsonMap	source map, or NULL if there is none
     * @param table		table to fill
     */
    private static void readTable(Map<String, Object> jsonMap, Map<String, ExchangeFlux> table) {
        if (jsonMap != null) {
            for (Map.Entry<String, Object> entry : jsonMap.entrySet())
                table.put(entry.getKey(), new ExchangeFlux((JsonArray) entry.getValue()));
        }
    }

    /**
     * @return a JSON object for this result
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(ResultKeys.OBJECTIVE.getKey(), ExchangeFlux.toJson(this.objective));
        retVal.put(ResultKeys.FEASIBLE.getKey(), this.feasible);
        retVal.put(ResultKeys.COMPLETE.getKey(), this.complete);
        retVal.put(ResultKeys.PROFILED.getKey(), this.profiled);
        retVal.put(ResultKeys.NET_PRODUCTION.getKey(), writeTable(this.netProduction));
        retVal.put(ResultKeys.NET_UPTAKE.getKey(), writeTable(this.netUptake));
        return retVal;
    }

    /**
     * @return a JSON object for a profile table
     *
     * @param table		table to convert
     */
    private static JsonObject writeTable(Map<String, ExchangeFlux> table) {
        JsonObject retVal = new JsonObject();
        for (Map.Entry<String, ExchangeFlux> entry : table.entrySet())
            retVal.put(entry.getKey(), entry.getValue().toJson());
        return retVal;
    }

    /**
     * Store the flux profiles for this result.
     *
     * @param fecalId		ID of the fecal exchange
     * @param production	net production fluxes
     * @param uptake		net uptake fluxes
     */
    public void putProfile(String fecalId, ExchangeFlux production, ExchangeFlux uptake) {
        this.netProduction.put(fecalId, production);
        this.netUptake.put(fecalId, uptake);
    }

    /**
     * Denote that the flux profiles for this result have been computed.  A community with no
     * fecal exchanges has empty profile tables but is still profiled.
     */
    public void markProfiled() {
        this.profiled = true;
    }

    /**
     * Denote that all the computations for this result have finished.
     */
    public void markComplete() {
        this.complete = true;
    }

    /**
     * @return TRUE if this result can be reused instead of recomputed
     *
     * @param profiles		TRUE if flux profiles were requested
     */
    public boolean isValid(boolean profiles) {
        return this.complete && (! this.feasible || ! profiles || this.profiled);
    }

    /**
     * @return the objective value (NaN if infeasible)
     */
    public double getObjective() {
        return this.objective;
    }

    /**
     * @return TRUE if the scenario was feasible
     */
    public boolean isFeasible() {
        return this.feasible;
    }

    /**
     * @return TRUE if the scenario's computations finished
     */
    public boolean isComplete() {
        return this.complete;
    }

    /**
     * @return TRUE if the flux profiles were computed
     */
    public boolean isProfiled() {
        return this.profiled;
    }

    /**
     * @return the net production table
     */
    public Map<String, ExchangeFlux> getNetProduction() {
        return Collections.unmodifiableMap(this.netProduction);
    }

    /**
     * @return the net uptake table
     */
    public Map<String, ExchangeFlux> getNetUptake() {
        return Collections.unmodifiableMap(this.netUptake);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.objective, this.feasible, this.complete, this.profiled, this.netProduction, this.netUptake);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof ScenarioResult))
            return false;
        ScenarioResult other = (ScenarioResult) obj;
        return Double.compare(this.objective, other.objective) == 0 && this.feasible == other.feasible
                && this.complete == other.complete && this.profiled == other.profiled
                && this.netProduction.equals(other.netProduction)
                && this.netUptake.equals(other.netUptake);
    }

    @Override
    public String toString() {
        return (this.feasible ? "objective " + this.objective : "infeasible") + (this.complete ? "" : " (incomplete)");
    }

}
