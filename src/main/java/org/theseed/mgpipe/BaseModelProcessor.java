/**
 *
 */
package org.theseed.mgpipe;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.community.JsonModelStore;
import org.theseed.community.MetaModel;

/**
 * This is a base class for commands against a single metabolic model.
 *
 * The positional parameter is the name of the model JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 */
public abstract class BaseModelProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseModelProcessor.class);
    /** metabolic model */
    private MetaModel model;

    // COMMAND-LINE OPTIONS

    /** model JSON file */
    @Argument(index = 0, metaVar = "model.json", usage = "JSON file for metabolic model",
            required = true)
    private File modelFile;

    @Override
    protected final void setDefaults() {
        this.setModelDefaults();
    }

    /**
     * Set the default options for the subclass.
     */
    protected abstract void setModelDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (! this.modelFile.canRead())
            throw new FileNotFoundException("Model file " + this.modelFile + " is not found or unreadable.");
        log.info("Loading model from {}.", this.modelFile);
        this.model = JsonModelStore.read(this.modelFile);
        log.info("{} loaded.", this.model);
        this.validateModelParms();
        return true;
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateModelParms() throws IOException, ParseFailureException;

    /**
     * @return the model
     */
    protected MetaModel getModel() {
        return this.model;
    }
}
