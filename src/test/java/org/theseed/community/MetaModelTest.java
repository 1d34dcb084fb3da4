/**
 *
 */
package org.theseed.community;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class MetaModelTest {

    @Test
    public void testStructure() {
        MetaModel model = ModelFixtures.rawOrganism("org1", "glc_D", "nut1");
        assertThat(model.getMetaboliteCount(), equalTo(5));
        assertThat(model.getReactionCount(), equalTo(8));
        assertThat(model.getCoefficient("glc_D[c]", "biomass0"), equalTo(-1.0));
        assertThat(model.getCoefficient("biomass[c]", "biomass0"), equalTo(1.0));
        assertThat(model.getCoefficient("nut1[e]", "biomass0"), equalTo(0.0));
        assertThat(model.getCoefficient("glc_D[c]", "nosuch"), equalTo(0.0));
        assertThat(model.getMetabolites(Compartment.EXTRACELLULAR), contains("glc_D[e]", "nut1[e]"));
        assertThat(model.getObjectiveReactions(), contains("biomass0"));
        assertThat(model.getReactions(ReactionRole.EXCHANGE).size(), equalTo(3));
        assertThat(model.getReactionsFor("glc_D[c]").size(), equalTo(4));
        assertThat(model.getGenes().getGenes(), contains("g1", "g2"));
        model.validate();
    }

    @Test
    public void testAddErrors() {
        MetaModel model = new MetaModel("bad");
        model.addMetabolite("a[c]");
        assertThat(model.addMetabolite("a[c]"), equalTo(false));
        model.addReaction(new Reaction("R1").setCoefficient("a[c]", -1.0));
        assertThrows(ModelStructureException.class, () -> model.addReaction(new Reaction("R1")));
        assertThrows(ModelStructureException.class,
                () -> model.addReaction(new Reaction("R2").setCoefficient("b[c]", 1.0)));
        assertThrows(ModelStructureException.class, () -> model.requireReaction("R2"));
        assertThat(model.getReaction("R2"), nullValue());
    }

    @Test
    public void testCopyAndRemove() {
        MetaModel model = ModelFixtures.rawOrganism("org1", "glc_D");
        MetaModel copy = model.copy();
        copy.getReaction("biomass0").setBounds(0.1, 5.0);
        assertThat(model.getReaction("biomass0").getLowerBound(), equalTo(0.0));
        Set<String> removed = copy.removeReactions(Arrays.asList("EX_glc_D[e]", "glc_Dt"), true);
        assertThat(removed, contains("glc_D[e]"));
        assertThat(copy.hasMetabolite("glc_D[e]"), equalTo(false));
        assertThat(copy.hasMetabolite("glc_D[c]"), equalTo(true));
        assertThat(model.hasReaction("glc_Dt"), equalTo(true));
        assertThat(model.getMetaboliteCount(), equalTo(3));
    }

    @Test
    public void testRenaming() {
        MetaModel model = ModelFixtures.rawOrganism("org1", "glc_D");
        MetaModel renamed = model.renamed("x", m -> "x_" + m, r -> "x_" + r);
        assertThat(renamed.getName(), equalTo("x"));
        assertThat(renamed.hasMetabolite("x_glc_D[e]"), equalTo(true));
        assertThat(renamed.getCoefficient("x_glc_D[c]", "x_biomass0"), equalTo(-1.0));
        assertThat(renamed.getGenes().getRule("x_biomass0"), equalTo("g1 and g2"));
        assertThat(renamed.getReaction("x_DM_glc_D[c]").getOwner(), equalTo("x"));
        assertThat(model.hasReaction("biomass0"), equalTo(true));
        // A rename onto an existing reaction is refused.
        assertThrows(ModelStructureException.class, () -> model.renameReactions(Map.of("glc_Dt", "biomass0")));
        model.setObjective("glc_Dt");
        assertThat(model.getObjectiveReactions(), contains("glc_Dt"));
    }

}
