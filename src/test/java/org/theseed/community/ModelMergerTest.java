/**
 *
 */
package org.theseed.community;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ModelMergerTest {

    private static MetaModel adapted(String name, String... nutrients) {
        return OrganismAdapter.adapt(ModelFixtures.rawOrganism(name, nutrients), name, ModelFixtures.OBJECTIVE);
    }

    @Test
    public void testDisjointUnion() {
        MetaModel a = adapted("org1", "glc_D", "nut1");
        MetaModel b = adapted("org2", "glc_D", "nut2");
        MetaModel merged = ModelMerger.merge(a, b, ModelMerger.Mode.DISJOINT, true);
        assertThat(merged.getMetaboliteCount(), greaterThanOrEqualTo(a.getMetaboliteCount()));
        assertThat(merged.getMetaboliteCount(), greaterThanOrEqualTo(b.getMetaboliteCount()));
        // glc_D[u] is shared, so it appears once.
        assertThat(merged.getMetaboliteCount(), equalTo(a.getMetaboliteCount() + b.getMetaboliteCount() - 1));
        assertThat(merged.getReactionCount(), equalTo(a.getReactionCount() + b.getReactionCount()));
        assertThat(merged.getReactionsFor("glc_D[u]").size(), equalTo(2));
        assertThat(merged.getGenes().getRule("org2_biomass0"), equalTo("g1 and g2"));
        // The inputs are unchanged.
        assertThat(a.getReactionCount(), equalTo(7));
        assertThat(a.hasMetabolite("org2_glc_D[c]"), equalTo(false));
        MetaModel noGenes = ModelMerger.merge(a, b, ModelMerger.Mode.DISJOINT, false);
        assertThat(noGenes.getGenes().isEmpty(), equalTo(true));
        assertThat(a.getGenes().isEmpty(), equalTo(false));
    }

    @Test
    public void testGlued() {
        MetaModel a = new MetaModel("a");
        a.addMetabolite("x[c]");
        a.addMetabolite("y[c]");
        a.addReaction(new Reaction("R1").setCoefficient("x[c]", -1.0).setCoefficient("y[c]", 1.0));
        MetaModel b = new MetaModel("b");
        b.addMetabolite("y[c]");
        b.addMetabolite("z[c]");
        b.addReaction(new Reaction("R2").setCoefficient("y[c]", -1.0).setCoefficient("z[c]", 1.0));
        MetaModel merged = ModelMerger.merge(a, b, ModelMerger.Mode.GLUED, false);
        assertThat(merged.getMetabolites(), contains("x[c]", "y[c]", "z[c]"));
        assertThat(merged.getCoefficient("y[c]", "R1"), equalTo(1.0));
        assertThat(merged.getCoefficient("y[c]", "R2"), equalTo(-1.0));
        // The same pair is illegal when the models are supposed to be namespaced.
        assertThrows(ModelStructureException.class, () -> ModelMerger.merge(a, b, ModelMerger.Mode.DISJOINT, false));
    }

    @Test
    public void testReactionConflict() {
        MetaModel a = adapted("org1", "glc_D");
        MetaModel b = a.copy();
        b.setName("copy");
        assertThrows(ModelStructureException.class, () -> ModelMerger.merge(a, b, ModelMerger.Mode.GLUED, false));
        // The failed merge did not change the target.
        MetaModel target = a.copy();
        int count = target.getReactionCount();
        assertThrows(ModelStructureException.class,
                () -> ModelMerger.mergeInto(target, b, ModelMerger.Mode.GLUED, false));
        assertThat(target.getReactionCount(), equalTo(count));
    }

}
