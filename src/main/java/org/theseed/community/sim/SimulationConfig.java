/**
 *
 */
package org.theseed.community.sim;

import java.util.ArrayList;
import java.util.List;

/**
 * This object contains the options for a simulation batch.  The setters return the object
 * itself so that they can be chained.
 */
public class SimulationConfig {

    // FIELDS
    /** TRUE to simulate the rich-diet scenario */
    private boolean rich;
    /** TRUE to simulate the personalized-diet scenario */
    private boolean personalized;
    /** TRUE to save the constrained models */
    private boolean saveModels;
    /** TRUE to compute exchange flux profiles */
    private boolean profiles;
    /** TRUE to ignore saved results */
    private boolean repeat;
    /** standard diet */
    private DietTable diet;
    /** personalized diets, or NULL if there are none */
    private PersonalizedDietTable personalDiets;

    /**
     * Construct a configuration with default options and an empty standard diet.
     */
    public SimulationConfig() {
        this.rich = false;
        this.personalized = false;
        this.saveModels = false;
        this.profiles = true;
        this.repeat = false;
        this.diet = new DietTable();
        this.personalDiets = null;
    }

    /**
     * @return the scenarios to simulate for each sample, in order
     */
    public List<Scenario> getScenarios() {
        List<Scenario> retVal = new ArrayList<Scenario>(3);
        if (this.rich)
            retVal.add(Scenario.RICH);
        retVal.add(Scenario.STANDARD);
        if (this.personalized)
            retVal.add(Scenario.PERSONALIZED);
        return retVal;
    }

    /**
     * @return TRUE if the rich-diet scenario is simulated
     */
    public boolean isRich() {
        return this.rich;
    }

    /**
     * Specify whether to simulate the rich-diet scenario.
     *
     * @param rich 	TRUE to simulate it
     */
    public SimulationConfig setRich(boolean rich) {
        this.rich = rich;
        return this;
    }

    /**
     * @return TRUE if the personalized-diet scenario is simulated
     */
    public boolean isPersonalized() {
        return this.personalized;
    }

    /**
     * Specify the personalized diets.  If they are non-NULL, the personalized scenario is simulated.
     *
     * @param personalDiets 	the personalized diets, or NULL to skip the scenario
     */
    public SimulationConfig setPersonalDiets(PersonalizedDietTable personalDiets) {
        this.personalDiets = personalDiets;
        this.personalized = (personalDiets != null);
        return this;
    }

    /**
     * @return the personalized diets, or NULL if there are none
     */
    public PersonalizedDietTable getPersonalDiets() {
        return this.personalDiets;
    }

    /**
     * @return TRUE if constrained models are saved
     */
    public boolean isSaveModels() {
        return this.saveModels;
    }

    /**
     * Specify whether to save the constrained models.
     *
     * @param saveModels 	TRUE to save them
     */
    public SimulationConfig setSaveModels(boolean saveModels) {
        this.saveModels = saveModels;
        return this;
    }

    /**
     * @return TRUE if exchange flux profiles are computed
     */
    public boolean isProfiles() {
        return this.profiles;
    }

    /**
     * Specify whether to compute exchange flux profiles.
     *
     * @param profiles 	TRUE to compute them
     */
    public SimulationConfig setProfiles(boolean profiles) {
        this.profiles = profiles;
        return this;
    }

    /**
     * @return TRUE if saved results are ignored
     */
    public boolean isRepeat() {
        return this.repeat;
    }

    /**
     * Specify whether to ignore saved results.
     *
     * @param repeat 	TRUE to recompute every sample
     */
    public SimulationConfig setRepeat(boolean repeat) {
        this.repeat = repeat;
        return this;
    }

    /**
     * @return the standard diet
     */
    public DietTable getDiet() {
        return this.diet;
    }

    /**
     * Specify the standard diet.
     *
     * @param diet 	the diet to use
     */
    public SimulationConfig setDiet(DietTable diet) {
        this.diet = diet;
        return this;
    }

}
