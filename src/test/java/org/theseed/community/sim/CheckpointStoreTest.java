/**
 *
 */
package org.theseed.community.sim;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CheckpointStoreTest {

    @TempDir
    File tempDir;

    /**
     * @return a sample result with a profiled standard scenario and an infeasible personalized one
     *
     * @param sampleId	ID of the sample
     * @param objective	objective value for the standard scenario
     */
    private static SampleResult sample(String sampleId, double objective) {
        SampleResult retVal = new SampleResult(sampleId);
        ScenarioResult standard = ScenarioResult.feasible(objective);
        standard.putProfile("EX_nut1[fe]", new ExchangeFlux(-10.0, 9.5), new ExchangeFlux(-0.0, 0.0));
        standard.putProfile("EX_ac[fe]", new ExchangeFlux(Double.NaN, 3.25), new ExchangeFlux(Double.NaN, 0.0));
        standard.markProfiled();
        standard.markComplete();
        retVal.put(Scenario.STANDARD, standard);
        retVal.put(Scenario.PERSONALIZED, ScenarioResult.infeasible());
        return retVal;
    }

    @Test
    public void testResults() {
        ScenarioResult result = ScenarioResult.feasible(0.8);
        assertThat(result.isFeasible(), equalTo(true));
        assertThat(result.isComplete(), equalTo(false));
        assertThat(result.isValid(false), equalTo(false));
        result.markComplete();
        assertThat(result.isValid(false), equalTo(true));
        // A feasible result with no profile is only good enough if profiles were not wanted.
        assertThat(result.isValid(true), equalTo(false));
        // A community with no fecal exchanges is profiled with empty tables.
        result.markProfiled();
        assertThat(result.getNetProduction().isEmpty(), equalTo(true));
        assertThat(result.isValid(true), equalTo(true));
        ScenarioResult reloaded = new ScenarioResult(result.toJson());
        assertThat(reloaded.isProfiled(), equalTo(true));
        assertThat(reloaded.isValid(true), equalTo(true));
        assertThat(reloaded, equalTo(result));
        ScenarioResult infeasible = ScenarioResult.infeasible();
        assertThat(infeasible.isComplete(), equalTo(true));
        assertThat(infeasible.isValid(true), equalTo(true));
        assertThat(Double.isNaN(infeasible.getObjective()), equalTo(true));
        SampleResult sample = sample("S1", 1.0);
        assertThat(sample.isValid(Arrays.asList(Scenario.STANDARD, Scenario.PERSONALIZED), true), equalTo(true));
        assertThat(sample.isValid(Arrays.asList(Scenario.RICH, Scenario.STANDARD), true), equalTo(false));
        assertThat(new ExchangeFlux(-0.0, 1.0), equalTo(new ExchangeFlux(0.0, 1.0)));
    }

    @Test
    public void testState() {
        CheckpointState state = new CheckpointState();
        assertThat(state.getLastCompletedSampleIndex(), equalTo(-1));
        state.complete(0, sample("S1", 1.0));
        state.complete(2, sample("S3", 0.5));
        state.complete(1, sample("S2", 0.75));
        assertThat(state.getLastCompletedSampleIndex(), equalTo(2));
        Map<String, Map<Scenario, Double>> presol = state.getPresol();
        assertThat(presol.keySet(), contains("S1", "S3", "S2"));
        assertThat(presol.get("S2").keySet(), contains(Scenario.STANDARD));
        assertThat(presol.get("S2").get(Scenario.STANDARD), equalTo(0.75));
        assertThat(state.getInfeasible().get("S3"), contains(Scenario.PERSONALIZED));
        CheckpointState copy = new CheckpointState(state.toJson());
        assertThat(copy, equalTo(state));
    }

    @Test
    public void testStore() throws IOException {
        File resultDir = new File(this.tempDir, "results");
        FileUtils.forceMkdir(resultDir);
        CheckpointStore store = new CheckpointStore(resultDir);
        CheckpointState state = store.load();
        assertThat(state.getSamples(), empty());
        assertThat(state.getLastCompletedSampleIndex(), equalTo(-1));
        state.complete(0, sample("S1", 1.0));
        store.saveIntermediate(state);
        assertThat(store.getIntermediateFile().isFile(), equalTo(true));
        assertThat(store.getFinalFile().exists(), equalTo(false));
        CheckpointState loaded = store.load();
        assertThat(loaded, equalTo(state));
        assertThat(loaded.get("S1").get(Scenario.STANDARD).getNetProduction().get("EX_ac[fe]").getFecal(), equalTo(3.25));
        // The final file wins over the intermediate one.
        state.complete(1, sample("S2", 0.25));
        store.saveFinal(state);
        loaded = store.load();
        assertThat(loaded.getLastCompletedSampleIndex(), equalTo(1));
        assertThat(loaded, equalTo(state));
        // No temporary files are left behind.
        assertThat(resultDir.list(), arrayContainingInAnyOrder(CheckpointStore.INTERMEDIATE_NAME, CheckpointStore.FINAL_NAME));
        String text = FileUtils.readFileToString(store.getFinalFile(), StandardCharsets.UTF_8);
        assertThat(text, containsString("inFesMat"));
        assertThat(text, containsString("presol"));
        store.clear();
        assertThat(store.load().getSamples(), empty());
        FileUtils.writeStringToFile(store.getIntermediateFile(), "{\"samples\": [", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> store.load());
    }

}
