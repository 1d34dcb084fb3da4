/**
 *
 */
package org.theseed.community.sim;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.theseed.community.CommunityAssembler;
import org.theseed.community.MetaModel;
import org.theseed.community.ModelStructureException;
import org.theseed.community.Reaction;
import org.theseed.community.ReactionRole;

public class ConstraintPolicyTest {

    @Test
    public void testBase() throws IOException {
        MetaModel community = SimFixtures.community("S1", false, Arrays.asList("org1", "org2"));
        ConstraintPolicy policy = new ConstraintPolicy(new PolicyParameters().setLowerBiomassBound(0.3));
        MetaModel base = policy.applyBase(community);
        // The input is not modified.
        assertThat(community.hasReaction("EX_glc_D[d]"), equalTo(true));
        assertThat(community.requireReaction("org1_DM_glc_D[c]").getLowerBound(), equalTo(0.5));
        assertThat(base.getObjectiveReactions(), contains(CommunityAssembler.COMMUNITY_OBJECTIVE));
        Reaction biomass = base.requireReaction(ReactionRole.COMMUNITY_BIOMASS_ID);
        assertThat(biomass.getLowerBound(), equalTo(0.3));
        assertThat(biomass.getUpperBound(), equalTo(1.0));
        assertThat(ConstraintPolicy.members(biomass), contains("org1", "org2"));
        assertThat(base.requireReaction("org1_DM_glc_D[c]").getLowerBound(), equalTo(0.0));
        assertThat(base.requireReaction("org2_sink_glc_D[c]").getLowerBound(), equalTo(-1.0));
        assertThat(base.requireReaction("org1_biomass0").getLowerBound(), equalTo(0.0));
        // Diet exchanges are renamed and the diet and fecal reactions are opened.
        assertThat(base.hasReaction("EX_glc_D[d]"), equalTo(false));
        Reaction dietEx = base.requireReaction("Diet_EX_glc_D[d]");
        assertThat(dietEx.getRole(), equalTo(ReactionRole.DIET_EXCHANGE));
        assertThat(dietEx.getUpperBound(), equalTo(ConstraintPolicy.OPEN_LIMIT));
        assertThat(dietEx.getLowerBound(), equalTo(-1000.0));
        assertThat(base.requireReaction("DUt_nut1").getUpperBound(), equalTo(ConstraintPolicy.OPEN_LIMIT));
        assertThat(base.requireReaction("UFEt_nut2").getUpperBound(), equalTo(ConstraintPolicy.OPEN_LIMIT));
        assertThat(base.requireReaction("EX_nut2[fe]").getUpperBound(), equalTo(ConstraintPolicy.OPEN_LIMIT));
        assertThat(base.requireReaction("org1_IEX_nut1[u]tr").getUpperBound(), equalTo(1000.0));
    }

    @Test
    public void testScenarios() throws IOException {
        MetaModel community = SimFixtures.community("S1", false, Arrays.asList("org1", "org2"));
        ConstraintPolicy policy = new ConstraintPolicy(new PolicyParameters());
        MetaModel base = policy.applyBase(community);
        DietTable diet = SimFixtures.diet(10.0, "nut1");
        MetaModel rich = policy.applyScenario(base, Scenario.RICH, diet);
        assertThat(rich.requireReaction("Diet_EX_nut2[d]").getLowerBound(), equalTo(-1000.0));
        MetaModel standard = policy.applyScenario(base, Scenario.STANDARD, diet);
        assertThat(standard.requireReaction("Diet_EX_glc_D[d]").getLowerBound(), equalTo(-10.0));
        assertThat(standard.requireReaction("Diet_EX_nut1[d]").getLowerBound(), equalTo(-10.0));
        assertThat(standard.requireReaction("Diet_EX_nut2[d]").getLowerBound(), equalTo(0.0));
        assertThat(standard.requireReaction("Diet_EX_nut2[d]").getUpperBound(), equalTo(ConstraintPolicy.OPEN_LIMIT));
        // The base model is untouched.
        assertThat(base.requireReaction("Diet_EX_nut2[d]").getLowerBound(), equalTo(-1000.0));
        MetaModel full = policy.apply(community, Scenario.STANDARD, diet);
        assertThat(full.requireReaction("Diet_EX_nut1[d]").getLowerBound(), equalTo(-10.0));
        assertThat(full.getObjectiveReactions(), contains(CommunityAssembler.COMMUNITY_OBJECTIVE));
    }

    @Test
    public void testHost() throws IOException {
        MetaModel community = SimFixtures.community("S1", true, Arrays.asList("org1", "org2"));
        PolicyParameters parms = new PolicyParameters().setHostBiomassReaction(SimFixtures.HOST_BIOMASS)
                .setHostBiomassCap(0.5);
        ConstraintPolicy policy = new ConstraintPolicy(parms);
        MetaModel base = policy.applyBase(community);
        assertThat(base.requireReaction("Host_biomass_maintenance").getLowerBound(), equalTo(0.001));
        assertThat(base.requireReaction("Host_biomass_maintenance").getUpperBound(), equalTo(0.5));
        assertThat(base.requireReaction("Host_EX_h2o[e]b").getLowerBound(), equalTo(-100.0));
        assertThat(base.requireReaction("Host_EX_glc_D[e]b").getLowerBound(), equalTo(0.0));
        assertThat(base.requireReaction("Host_IEX_gchola[u]tr").getLowerBound(), equalTo(-1000.0));
        assertThat(base.requireReaction("Host_IEX_glc_D[u]tr").getLowerBound(), equalTo(0.0));
        // The host is not a community member, so its demand keeps its bounds.
        assertThat(base.requireReaction("Host_DM_bio[c]").getLowerBound(), equalTo(0.0));
        DietTable diet = SimFixtures.diet(10.0, "nut1", "nut2");
        MetaModel standard = policy.applyScenario(base, Scenario.STANDARD, diet);
        assertThat(standard.requireReaction("Diet_EX_gchola[d]").getLowerBound(), equalTo(0.0));
        parms.setIncludeHumanMets(true);
        standard = policy.applyScenario(base, Scenario.STANDARD, diet);
        assertThat(standard.requireReaction("Diet_EX_gchola[d]").getLowerBound(), equalTo(-10.0));
        // A missing host biomass reaction is an error.
        ConstraintPolicy bad = new ConstraintPolicy(new PolicyParameters().setHostBiomassReaction("biomass_none"));
        assertThrows(ModelStructureException.class, () -> bad.applyBase(community));
    }

}
