/**
 *
 */
package org.theseed.community;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

public class MergeTreeSchedulerTest {

    @Test
    public void testResolve() {
        MergeTreeScheduler scheduler = new MergeTreeScheduler(MergeTreeScheduler.Strategy.AUTO, 3, 1);
        assertThat(scheduler.resolve(3), equalTo(MergeTreeScheduler.Strategy.BALANCED));
        assertThat(scheduler.resolve(4), equalTo(MergeTreeScheduler.Strategy.SEQUENTIAL));
        scheduler = new MergeTreeScheduler(MergeTreeScheduler.Strategy.SEQUENTIAL, 3, 1);
        assertThat(scheduler.resolve(1), equalTo(MergeTreeScheduler.Strategy.SEQUENTIAL));
    }

    @Test
    public void testEveryOrganismPresent() throws IOException {
        MergeTreeScheduler balanced = new MergeTreeScheduler(MergeTreeScheduler.Strategy.BALANCED, 500, 1);
        MergeTreeScheduler sequential = new MergeTreeScheduler(MergeTreeScheduler.Strategy.SEQUENTIAL, 500, 1);
        MergeTreeScheduler parallel = new MergeTreeScheduler(MergeTreeScheduler.Strategy.BALANCED, 500, 4);
        for (int n = 1; n <= 9; n++) {
            Map<String, MetaModel> raws = ModelFixtures.organisms(n);
            List<String> names = new ArrayList<String>(raws.keySet());
            MergeTreeScheduler.ModelLoader loader = ModelFixtures.loader(raws);
            MetaModel tree = balanced.merge(names, loader);
            assertThat(String.valueOf(n), tree.getReactionCount(), equalTo(7 * n));
            // Each organism has five private metabolites, plus its own nutrient in the lumen and the shared glucose.
            assertThat(String.valueOf(n), tree.getMetaboliteCount(), equalTo(6 * n + 1));
            for (String name : names)
                assertThat(tree.hasReaction(name + "_biomass0"), equalTo(true));
            // Gene rules are not carried into the community.
            if (n > 1)
                assertThat(tree.getGenes().isEmpty(), equalTo(true));
            MetaModel fold = sequential.merge(names, loader);
            assertThat(ids(fold), equalTo(ids(tree)));
            assertThat(new HashSet<String>(fold.getMetabolites()), equalTo(new HashSet<String>(tree.getMetabolites())));
            assertThat(String.valueOf(n), columns(fold), equalTo(columns(tree)));
            MetaModel pooled = parallel.merge(names, loader);
            assertThat(ids(pooled), equalTo(ids(tree)));
            assertThat(new HashSet<String>(pooled.getMetabolites()), equalTo(new HashSet<String>(tree.getMetabolites())));
            assertThat(String.valueOf(n), columns(pooled), equalTo(columns(tree)));
            tree.validate();
        }
    }

    @Test
    public void testReverseOrder() throws IOException {
        Map<String, MetaModel> raws = ModelFixtures.organisms(5);
        List<String> names = new ArrayList<String>(raws.keySet());
        MergeTreeScheduler scheduler = new MergeTreeScheduler(MergeTreeScheduler.Strategy.BALANCED, 500, 1);
        MetaModel forward = scheduler.merge(names, ModelFixtures.loader(raws));
        Collections.reverse(names);
        MetaModel backward = scheduler.merge(names, ModelFixtures.loader(raws));
        assertThat(ids(backward), equalTo(ids(forward)));
        assertThat(columns(backward), equalTo(columns(forward)));
        MetaModel fold = new MergeTreeScheduler(MergeTreeScheduler.Strategy.SEQUENTIAL, 500, 1)
                .merge(names, ModelFixtures.loader(raws));
        assertThat(columns(fold), equalTo(columns(forward)));
    }

    @Test
    public void testDisjointCounts() throws IOException {
        Map<String, MetaModel> models = Map.of("A", tiny("A"), "B", tiny("B"));
        MergeTreeScheduler scheduler = new MergeTreeScheduler(MergeTreeScheduler.Strategy.BALANCED, 500, 1);
        MetaModel merged = scheduler.merge(Arrays.asList("A", "B"), x -> models.get(x).copy());
        assertThat(merged.getMetaboliteCount(), equalTo(6));
        assertThat(merged.getReactionCount(), equalTo(8));
        MetaModel compartments = CompartmentBuilder.build(Arrays.asList("x[u]", "y[u]", "z[u]"),
                Collections.emptyList(), ModelFixtures.OBJECTIVE);
        assertThat(compartments.getMetaboliteCount(), equalTo(9));
        assertThat(compartments.getReactionCount(), equalTo(12));
        ModelMerger.mergeInto(merged, compartments, ModelMerger.Mode.GLUED, false);
        assertThat(merged.getMetaboliteCount(), equalTo(15));
        assertThat(merged.getReactionCount(), equalTo(20));
    }

    @Test
    public void testFailures() {
        MergeTreeScheduler scheduler = new MergeTreeScheduler(MergeTreeScheduler.Strategy.BALANCED, 500, 2);
        assertThrows(ModelStructureException.class, () -> scheduler.merge(Collections.emptyList(),
                ModelFixtures.loader(Collections.emptyMap())));
        Map<String, MetaModel> raws = ModelFixtures.organisms(4);
        List<String> names = new ArrayList<String>(raws.keySet());
        names.add("missing");
        assertThrows(IOException.class, () -> scheduler.merge(names, ModelFixtures.loader(raws)));
    }

    /**
     * @return a model with three private metabolites and four reactions
     *
     * @param prefix	prefix for the identifiers
     */
    private static MetaModel tiny(String prefix) {
        MetaModel retVal = new MetaModel(prefix);
        String a = prefix + "_a[c]";
        String b = prefix + "_b[c]";
        String c = prefix + "_c[e]";
        retVal.addMetabolite(a);
        retVal.addMetabolite(b);
        retVal.addMetabolite(c);
        retVal.addReaction(new Reaction(prefix + "_R1").setCoefficient(c, -1.0).setCoefficient(a, 1.0));
        retVal.addReaction(new Reaction(prefix + "_R2").setCoefficient(a, -1.0).setCoefficient(b, 1.0));
        retVal.addReaction(new Reaction(prefix + "_R3").setCoefficient(b, -2.0).setCoefficient(c, 1.0));
        retVal.addReaction(new Reaction(prefix + "_DM_b[c]", 0.0, 1000.0).setCoefficient(b, -1.0));
        return retVal;
    }

    /**
     * @return a map from each reaction ID to its coefficients, bounds and objective
     *
     * @param model		model of interest
     */
    private static Map<String, List<Object>> columns(MetaModel model) {
        Map<String, List<Object>> retVal = new HashMap<String, List<Object>>();
        for (Reaction reaction : model.getReactions())
            retVal.put(reaction.getId(), Arrays.asList(new HashMap<String, Double>(reaction.getStoichiometry()),
                    reaction.getLowerBound(), reaction.getUpperBound(), reaction.getObjective()));
        return retVal;
    }

    /**
     * @return the set of reaction IDs in a model
     *
     * @param model		model of interest
     */
    private static Set<String> ids(MetaModel model) {
        return model.getReactions().stream().map(x -> x.getId()).collect(Collectors.toSet());
    }

}
