/**
 *
 */
package org.theseed.mgpipe;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.community.JsonModelStore;
import org.theseed.community.MetaModel;
import org.theseed.community.ModelFixtures;
import org.theseed.community.ModelStore;
import org.theseed.community.sim.CheckpointState;
import org.theseed.community.sim.CheckpointStore;
import org.theseed.community.sim.Scenario;

/**
 * Run the build, simulate, and summary commands end to end on fixture models.
 */
public class TestCommands {

    @TempDir
    File tempDir;

    @Test
    public void testPipeline() throws IOException {
        File orgDir = new File(this.tempDir, "organisms");
        JsonModelStore orgStore = new JsonModelStore(orgDir);
        for (int i = 1; i <= 3; i++) {
            String name = "org" + i;
            orgStore.save(name, ModelFixtures.rawOrganism(name, "glc_D", "nut" + i));
        }
        File abundanceFile = new File(this.tempDir, "abundance.tbl");
        FileUtils.writeStringToFile(abundanceFile, "organism\tS1\tS2\norg1\t10\t0\norg2\t10\t5\norg3\t0\t5\n",
                StandardCharsets.UTF_8);
        File commDir = new File(this.tempDir, "communities");
        BuildProcessor build = new BuildProcessor();
        boolean ok = build.parseCommand(new String[] { orgDir.getPath(), commDir.getPath(), abundanceFile.getPath(),
                "--strategy", "SEQUENTIAL" });
        assertThat(ok, equalTo(true));
        build.run();
        assertThat(build.isFailed(), equalTo(false));
        JsonModelStore commStore = new JsonModelStore(commDir);
        assertThat(commStore.contains(ModelStore.communityName("S1", false)), equalTo(true));
        MetaModel s2 = commStore.load(ModelStore.communityName("S2", false));
        assertThat(s2.hasReaction("org3_biomass0"), equalTo(true));
        assertThat(s2.hasReaction("org1_biomass0"), equalTo(false));
        // Summarize one of the communities.
        File summaryFile = new File(this.tempDir, "summary.tbl");
        SummaryProcessor summary = new SummaryProcessor();
        ok = summary.parseCommand(new String[] { "-o", summaryFile.getPath(), "--role", "DIET_EXCHANGE",
                commStore.getFile(ModelStore.communityName("S1", false)).getPath() });
        assertThat(ok, equalTo(true));
        summary.run();
        String text = FileUtils.readFileToString(summaryFile, StandardCharsets.UTF_8);
        assertThat(text, containsString("reactions\tCOMMUNITY_BIOMASS\t1"));
        assertThat(text, containsString("metabolites\tDIET\t3"));
        assertThat(text, containsString("EX_nut1[d]\t-1000.0\t1000.0"));
        // Without a role, only the counts are written.
        File countFile = new File(this.tempDir, "counts.tbl");
        summary = new SummaryProcessor();
        ok = summary.parseCommand(new String[] { "--output", countFile.getPath(),
                commStore.getFile(ModelStore.communityName("S1", false)).getPath() });
        assertThat(ok, equalTo(true));
        summary.run();
        text = FileUtils.readFileToString(countFile, StandardCharsets.UTF_8);
        assertThat(text, startsWith("category\ttype\tcount"));
        assertThat(text, containsString("metabolites\tFECAL\t"));
        assertThat(text, not(containsString("reaction_id")));
        // Simulate the batch.  Only nut1 and nut2 are in the diet, so S2 is infeasible.
        File dietFile = new File(this.tempDir, "diet.tbl");
        FileUtils.writeStringToFile(dietFile, "rxn\tflux\nEX_glc_D(e)\t10\nEX_nut1(e)\t10\nEX_nut2(e)\t10\n",
                StandardCharsets.UTF_8);
        File resultDir = new File(this.tempDir, "results");
        SimulateProcessor simulate = new SimulateProcessor();
        ok = simulate.parseCommand(new String[] { "--noProfiles", "--rich", commDir.getPath(), resultDir.getPath(),
                dietFile.getPath(), "S1", "S2" });
        assertThat(ok, equalTo(true));
        simulate.run();
        assertThat(simulate.isFailed(), equalTo(false));
        CheckpointState state = CheckpointStore.read(new File(resultDir, CheckpointStore.FINAL_NAME));
        assertThat(state.getLastCompletedSampleIndex(), equalTo(1));
        assertThat(state.get("S1").get(Scenario.STANDARD).getObjective(), closeTo(1.0, 1e-6));
        assertThat(state.get("S2").get(Scenario.RICH).getObjective(), closeTo(1.0, 1e-6));
        assertThat(state.getInfeasible().get("S2"), contains(Scenario.STANDARD));
    }

    @Test
    public void testBadParms() throws IOException {
        File missing = new File(this.tempDir, "missing");
        BuildProcessor build = new BuildProcessor();
        assertThat(build.parseCommand(new String[] { missing.getPath(), missing.getPath(), missing.getPath() }),
                equalTo(false));
        assertThat(build.isFailed(), equalTo(true));
        File dietFile = new File(this.tempDir, "diet.tbl");
        FileUtils.writeStringToFile(dietFile, "rxn\tflux\n", StandardCharsets.UTF_8);
        SimulateProcessor simulate = new SimulateProcessor();
        assertThat(simulate.parseCommand(new String[] { "--fraction", "2.0", this.tempDir.getPath(),
                this.tempDir.getPath(), dietFile.getPath(), "S1" }), equalTo(false));
        assertThat(simulate.isFailed(), equalTo(true));
        SummaryProcessor summary = new SummaryProcessor();
        assertThat(summary.parseCommand(new String[] { "--role", "NONSENSE", dietFile.getPath() }), equalTo(false));
    }

}
