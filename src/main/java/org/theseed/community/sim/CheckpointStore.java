/**
 *
 */
package org.theseed.community.sim;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This class manages the checkpoint files in a simulation result directory.  The in-progress
 * file is rewritten after every sample, and the final file when the batch completes.  Each write
 * goes to a temporary file in the same directory that is then renamed over the target, so a
 * crash never leaves a partially-written checkpoint.
 */
public class CheckpointStore {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CheckpointStore.class);
    /** result directory */
    private File resultDir;
    /** name of the in-progress checkpoint file */
    public static final String INTERMEDIATE_NAME = "intRes.json";
    /** name of the final results file */
    public static final String FINAL_NAME = "simRes.json";

    /**
     * Construct a checkpoint store for a result directory.
     *
     * @param resultDir		directory to contain the checkpoint files
     */
    public CheckpointStore(File resultDir) {
        this.resultDir = resultDir;
    }

    /**
     * @return the in-progress checkpoint file
     */
    public File getIntermediateFile() {
        return new File(this.resultDir, INTERMEDIATE_NAME);
    }

    /**
     * @return the final results file
     */
    public File getFinalFile() {
        return new File(this.resultDir, FINAL_NAME);
    }

    /**
     * @return the most recent saved state, or an empty state if there is none
     *
     * The final file is preferred, since it is written last.
     *
     * @throws IOException
     */
    public CheckpointState load() throws IOException {
        CheckpointState retVal;
        File finalFile = this.getFinalFile();
        File intFile = this.getIntermediateFile();
        if (finalFile.isFile()) {
            log.info("Loading simulation results from {}.", finalFile);
            retVal = read(finalFile);
        } else if (intFile.isFile()) {
            log.info("Recovering interrupted simulation from {}.", intFile);
            retVal = read(intFile);
        } else
            retVal = new CheckpointState();
        return retVal;
    }

    /**
     * Write the in-progress checkpoint.
     *
     * @param state		state to save
     *
     * @throws IOException
     */
    public void saveIntermediate(CheckpointState state) throws IOException {
        this.write(state, this.getIntermediateFile());
        log.info("Checkpoint written after sample index {}.", state.getLastCompletedSampleIndex());
    }

    /**
     * Write the final results.
     *
     * @param state		state to save
     *
     * @throws IOException
     */
    public void saveFinal(CheckpointState state) throws IOException {
        this.write(state, this.getFinalFile());
        log.info("Final simulation results written to {}.", this.getFinalFile());
    }

    /**
     * Delete both checkpoint files.
     *
     * @throws IOException
     */
    public void clear() throws IOException {
        Files.deleteIfExists(this.getIntermediateFile().toPath());
        Files.deleteIfExists(this.getFinalFile().toPath());
    }

    /**
     * @return the checkpoint state in a file
     *
     * @param inFile	checkpoint file to read
     *
     * @throws IOException
     */
    public static CheckpointState read(File inFile) throws IOException {
        try (Reader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8)) {
            JsonObject json = (JsonObject) Jsoner.deserialize(reader);
            return new CheckpointState(json);
        } catch (JsonException | ClassCastException | NullPointerException e) {
            throw new IOException("Invalid checkpoint file " + inFile + ": " + e.toString());
        }
    }

    /**
     * Write a checkpoint state to a file by way of a temporary file.
     *
     * @param state		state to write
     * @param outFile	target file
     *
     * @throws IOException
     */
    private void write(CheckpointState state, File outFile) throws IOException {
        FileUtils.forceMkdir(this.resultDir);
        Path target = outFile.toPath();
        Path temp = Files.createTempFile(this.resultDir.toPath(), outFile.getName(), ".tmp");
        try {
            Files.write(temp, Jsoner.prettyPrint(Jsoner.serialize(state.toJson())).getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic rename not supported in {}.", this.resultDir);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

}
