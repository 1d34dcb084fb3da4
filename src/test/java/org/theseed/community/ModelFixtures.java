/**
 *
 */
package org.theseed.community;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small hand-built models shared by the community and simulation tests.
 */
public class ModelFixtures {

    /** organism biomass objective used by the fixtures */
    public static final String OBJECTIVE = "EX_biomass(e)";

    /**
     * @return a raw organism reconstruction
     *
     * Each nutrient has an extracellular and a cytosol metabolite, an exchange, and a transporter.
     * The biomass reaction consumes one unit of each cytosol nutrient.  There is a sink for the
     * first nutrient and a demand reaction with a positive lower bound.
     *
     * @param name			model name
     * @param nutrients		base names of the nutrients
     */
    public static MetaModel rawOrganism(String name, String... nutrients) {
        MetaModel retVal = new MetaModel(name);
        retVal.addMetabolite("biomass[c]");
        Reaction biomass = new Reaction("biomass0", 0.0, 1000.0);
        biomass.setObjective(1.0);
        for (String nutrient : nutrients) {
            String ext = nutrient + "[e]";
            String cyt = nutrient + "[c]";
            retVal.addMetabolite(ext);
            retVal.addMetabolite(cyt);
            retVal.addReaction(new Reaction("EX_" + ext).setCoefficient(ext, -1.0));
            retVal.addReaction(new Reaction(nutrient + "t").setCoefficient(ext, -1.0).setCoefficient(cyt, 1.0));
            biomass.setCoefficient(cyt, -1.0);
        }
        biomass.setCoefficient("biomass[c]", 1.0);
        retVal.addReaction(biomass);
        retVal.addReaction(new Reaction(OBJECTIVE, 0.0, 1000.0).setCoefficient("biomass[c]", -1.0));
        String first = nutrients[0] + "[c]";
        retVal.addReaction(new Reaction("sink_" + first).setCoefficient(first, -1.0));
        retVal.addReaction(new Reaction("DM_" + first, 0.5, 1000.0).setCoefficient(first, -1.0));
        retVal.getGenes().setRule("biomass0", "g1 and g2");
        return retVal;
    }

    /**
     * @return a loader that adapts raw fixture organisms on demand
     *
     * @param raws		map of organism names to raw models
     */
    public static MergeTreeScheduler.ModelLoader loader(Map<String, MetaModel> raws) {
        return x -> {
            MetaModel raw = raws.get(x);
            if (raw == null)
                throw new IOException("No model for " + x + ".");
            return OrganismAdapter.adapt(raw, x, OBJECTIVE);
        };
    }

    /**
     * @return a map of organism names to raw models, each using glucose plus one private nutrient
     *
     * @param count		number of organisms
     */
    public static Map<String, MetaModel> organisms(int count) {
        Map<String, MetaModel> retVal = new LinkedHashMap<String, MetaModel>();
        for (int i = 1; i <= count; i++) {
            String name = "org" + i;
            retVal.put(name, rawOrganism(name, "glc_D", "nut" + i));
        }
        return retVal;
    }

    /**
     * @return equal abundances for a set of organisms
     *
     * @param organisms		organism names
     */
    public static Map<String, Double> evenAbundances(Iterable<String> organisms) {
        List<String> names = new ArrayList<String>();
        organisms.forEach(x -> names.add(x));
        Map<String, Double> retVal = new LinkedHashMap<String, Double>();
        for (String name : names)
            retVal.put(name, 1.0 / names.size());
        return retVal;
    }

    /**
     * @return a simple host model
     *
     * The host takes up water and glucose through exchanges, has a glucose transporter, secretes
     * glycocholate, and grows on glucose.
     */
    public static MetaModel host() {
        MetaModel retVal = new MetaModel("human");
        for (String met : new String[] { "h2o[e]", "glc_D[e]", "glc_D[c]", "gchola[e]", "gchola[c]", "bio[c]" })
            retVal.addMetabolite(met);
        retVal.addReaction(new Reaction("EX_h2o[e]").setCoefficient("h2o[e]", -1.0));
        retVal.addReaction(new Reaction("EX_glc_D[e]").setCoefficient("glc_D[e]", -1.0));
        retVal.addReaction(new Reaction("EX_gchola[e]").setCoefficient("gchola[e]", -1.0));
        retVal.addReaction(new Reaction("GLCt").setCoefficient("glc_D[e]", -1.0).setCoefficient("glc_D[c]", 1.0));
        retVal.addReaction(new Reaction("GCHOLAt").setCoefficient("gchola[c]", -1.0).setCoefficient("gchola[e]", 1.0));
        retVal.addReaction(new Reaction("biomass_maintenance", 0.0, 1000.0).setCoefficient("glc_D[c]", -1.0)
                .setCoefficient("gchola[c]", 0.1).setCoefficient("bio[c]", 1.0));
        retVal.addReaction(new Reaction("DM_bio[c]", 0.0, 1000.0).setCoefficient("bio[c]", -1.0));
        return retVal;
    }

}
