/**
 *
 */
package org.theseed.community;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This is a model store that keeps each model in a JSON file in a directory.  The file name is
 * the model name with the suffix ".json".  A model name may contain a subdirectory path.
 *
 * The JSON format is an object with the model "id", a "metabolites" list of objects with an
 * "id", a "reactions" list of objects, and an optional "genes" list.  Each reaction object has an
 * "id", "lower_bound", "upper_bound", "objective_coefficient", a "metabolites" object mapping
 * metabolite IDs to coefficients, and an optional "gene_reaction_rule".
 */
public class JsonModelStore implements ModelStore {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(JsonModelStore.class);
    /** directory containing the model files */
    private File modelDir;

    private static enum ModelKeys implements JsonKey {
        ID("model"), METABOLITES(null), REACTIONS(null), GENES(null);

        private final Object m_value;

        private ModelKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        /** This is the default value used when the key is not found.
         */
        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    private static enum ReactionKeys implements JsonKey {
        ID(null), LOWER_BOUND(-Reaction.DEFAULT_LIMIT), UPPER_BOUND(Reaction.DEFAULT_LIMIT),
        OBJECTIVE_COEFFICIENT(0.0), GENE_REACTION_RULE("");

        private final Object m_value;

        private ReactionKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        /** This is the default value used when the key is not found.
         */
        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * Construct a model store for a directory.
     *
     * @param modelDir		directory containing the model files
     */
    public JsonModelStore(File modelDir) {
        this.modelDir = modelDir;
    }

    /**
     * @return the file for a model name
     *
     * @param name		model name
     */
    public File getFile(String name) {
        return new File(this.modelDir, name + ".json");
    }

    @Override
    public MetaModel load(String name) throws IOException {
        File inFile = this.getFile(name);
        if (! inFile.canRead())
            throw new FileNotFoundException("Model file " + inFile + " is not found or unreadable.");
        MetaModel retVal = read(inFile);
        log.debug("{} loaded from {}.", retVal, inFile);
        return retVal;
    }

    @Override
    public void save(String name, MetaModel model) throws IOException {
        File outFile = this.getFile(name);
        File parent = outFile.getParentFile();
        if (parent != null && ! parent.isDirectory())
            FileUtils.forceMkdir(parent);
        write(model, outFile);
        log.debug("{} saved to {}.", model, outFile);
    }

    @Override
    public boolean contains(String name) {
        return this.getFile(name).isFile();
    }

    /**
     * Read a model from a JSON file.
     *
     * @param inFile	file containing the model
     *
     * @return the model read
     *
     * @throws IOException
     */
    public static MetaModel read(File inFile) throws IOException {
        JsonObject modelObject;
        try (Reader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8)) {
            modelObject = (JsonObject) Jsoner.deserialize(reader);
        } catch (JsonException | ClassCastException e) {
            throw new IOException("JSON error in " + inFile + ":" + e.toString());
        }
        if (modelObject == null)
            throw new IOException("No model found in " + inFile + ".");
        try {
            return fromJson(modelObject);
        } catch (ModelStructureException | ClassCastException | NullPointerException e) {
            throw new IOException("Invalid model in " + inFile + ": " + e.getMessage());
        }
    }

    /**
     * Write a model to a JSON file.
     *
     * @param model		model to write
     * @param outFile	output file
     *
     * @throws IOException
     */
    public static void write(MetaModel model, File outFile) throws IOException {
        String jsonString = Jsoner.serialize(toJson(model));
        FileUtils.writeStringToFile(outFile, jsonString, StandardCharsets.UTF_8);
    }

    /**
     * @return a JSON object representing a model
     *
     * @param model		model to convert
     */
    public static JsonObject toJson(MetaModel model) {
        JsonObject retVal = new JsonObject();
        retVal.put(ModelKeys.ID.getKey(), model.getName());
        JsonArray mets = new JsonArray();
        for (String metId : model.getMetabolites()) {
            JsonObject met = new JsonObject();
            met.put("id", metId);
            mets.add(met);
        }
        retVal.put(ModelKeys.METABOLITES.getKey(), mets);
        GeneAssociations genes = model.getGenes();
        JsonArray reactions = new JsonArray();
        for (Reaction reaction : model.getReactions()) {
            JsonObject rxn = new JsonObject();
            rxn.put(ReactionKeys.ID.getKey(), reaction.getId());
            rxn.put(ReactionKeys.LOWER_BOUND.getKey(), reaction.getLowerBound());
            rxn.put(ReactionKeys.UPPER_BOUND.getKey(), reaction.getUpperBound());
            rxn.put(ReactionKeys.OBJECTIVE_COEFFICIENT.getKey(), reaction.getObjective());
            JsonObject stoich = new JsonObject();
            for (Map.Entry<String, Double> entry : reaction.getStoichiometry().entrySet())
                stoich.put(entry.getKey(), entry.getValue());
            rxn.put("metabolites", stoich);
            String rule = genes.getRule(reaction.getId());
            if (! rule.isEmpty())
                rxn.put(ReactionKeys.GENE_REACTION_RULE.getKey(), rule);
            reactions.add(rxn);
        }
        retVal.put(ModelKeys.REACTIONS.getKey(), reactions);
        if (! genes.isEmpty()) {
            JsonArray geneList = new JsonArray();
            for (String gene : genes.getGenes()) {
                JsonObject geneObject = new JsonObject();
                geneObject.put("id", gene);
                geneList.add(geneObject);
            }
            retVal.put(ModelKeys.GENES.getKey(), geneList);
        }
        return retVal;
    }

    /**
     * @return a model created from a JSON object
     *
     * @param modelObject	JSON object describing the model
     */
    public static MetaModel fromJson(JsonObject modelObject) {
        MetaModel retVal = new MetaModel(modelObject.getStringOrDefault(ModelKeys.ID));
        JsonArray mets = (JsonArray) modelObject.get(ModelKeys.METABOLITES.getKey());
        if (mets != null) {
            for (Object met : mets) {
                String metId = (String) ((JsonObject) met).get("id");
                if (StringUtils.isBlank(metId))
                    throw new ModelStructureException("Metabolite without an ID in model " + retVal.getName() + ".");
                if (! retVal.addMetabolite(metId))
                    throw new ModelStructureException("Duplicate metabolite " + metId + ".");
            }
        }
        JsonArray reactions = (JsonArray) modelObject.get(ModelKeys.REACTIONS.getKey());
        if (reactions != null) {
            for (Object rxnItem : reactions) {
                JsonObject rxn = (JsonObject) rxnItem;
                String rxnId = rxn.getStringOrDefault(ReactionKeys.ID);
                if (StringUtils.isBlank(rxnId))
                    throw new ModelStructureException("Reaction without an ID in model " + retVal.getName() + ".");
                Reaction reaction = new Reaction(rxnId,
                        number(rxn, ReactionKeys.LOWER_BOUND), number(rxn, ReactionKeys.UPPER_BOUND));
                reaction.setObjective(number(rxn, ReactionKeys.OBJECTIVE_COEFFICIENT));
                JsonObject stoich = (JsonObject) rxn.get("metabolites");
                if (stoich != null) {
                    for (Map.Entry<String, Object> entry : stoich.entrySet())
                        reaction.setCoefficient(entry.getKey(), ((Number) entry.getValue()).doubleValue());
                }
                retVal.addReaction(reaction);
                retVal.getGenes().setRule(reaction.getId(), rxn.getStringOrDefault(ReactionKeys.GENE_REACTION_RULE));
            }
        }
        return retVal;
    }

    /**
     * @return a numeric field from a JSON object
     *
     * @param object	source JSON object
     * @param key		key of the desired field
     */
    private static double number(JsonObject object, JsonKey key) {
        Object value = object.get(key.getKey());
        double retVal;
        if (value == null)
            retVal = ((Number) key.getValue()).doubleValue();
        else
            retVal = ((Number) value).doubleValue();
        return retVal;
    }

}
