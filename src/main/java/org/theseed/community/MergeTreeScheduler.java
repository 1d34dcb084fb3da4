/**
 *
 */
package org.theseed.community;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class merges the models for a list of organisms into a single community model.  The
 * organism models are loaded one at a time through a loader, so only the models currently being
 * merged need to be in memory.
 *
 * In the sequential strategy, the models are folded left to right into an accumulator.  In the
 * balanced strategy, each level of a binary tree merges adjacent pairs of the previous level's
 * models.  A level with an odd number of models sets the last one aside; the set-aside models are
 * folded into the tree result in level order once a single model remains.  Pair merges within a
 * level are independent and can run in parallel, but each level waits for the one before it.
 *
 * Both strategies produce the same metabolites, reactions and coefficients, because organism
 * models have disjoint namespaces apart from the shared lumen metabolites.
 */
public class MergeTreeScheduler {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(MergeTreeScheduler.class);
    /** merge strategy */
    private Strategy strategy;
    /** organism count above which AUTO uses the sequential strategy */
    private int sequentialThreshold;
    /** number of parallel merges allowed within a tree level */
    private int workers;
    /** default organism count threshold for AUTO */
    public static final int DEFAULT_THRESHOLD = 500;

    /**
     * This interface loads an organism model by name.
     */
    @FunctionalInterface
    public interface ModelLoader {

        /**
         * @return the model for the specified organism
         *
         * @param organism	name of the organism to load
         *
         * @throws IOException
         */
        public MetaModel load(String organism) throws IOException;

    }

    /**
     * This enumeration describes the merge strategies.
     */
    public static enum Strategy {
        /** fold the models one at a time into an accumulator */
        SEQUENTIAL,
        /** merge pairs in a binary tree */
        BALANCED,
        /** use the tree unless the organism count exceeds the threshold */
        AUTO;
    }

    /**
     * This is a merge-tree node:  a model and the number of organisms it contains.
     */
    private static class Node {

        /** merged model */
        private MetaModel model;
        /** number of organisms in the model */
        private int members;

        protected Node(MetaModel model, int members) {
            this.model = model;
            this.members = members;
        }

        /**
         * Merge another node into this one.
         *
         * @param other		node to absorb
         *
         * @return this node
         */
        protected Node absorb(Node other) {
            ModelMerger.mergeInto(this.model, other.model, ModelMerger.Mode.DISJOINT, false);
            this.members += other.members;
            return this;
        }

    }

    /**
     * This object contains the output of one tree level:  the merged pairs and the odd model left
     * over, if any.
     */
    private static class Level {

        /** merged pairs */
        private List<Node> merged;
        /** unmerged leftover, or NULL */
        private Node single;

        protected Level(List<Node> merged, Node single) {
            this.merged = merged;
            this.single = single;
        }

    }

    /**
     * Construct a merge scheduler.
     *
     * @param strategy		merge strategy
     * @param threshold		organism count above which AUTO goes sequential
     * @param workers		maximum number of parallel merges in a tree level
     */
    public MergeTreeScheduler(Strategy strategy, int threshold, int workers) {
        this.strategy = strategy;
        this.sequentialThreshold = threshold;
        this.workers = Math.max(1, workers);
    }

    /**
     * @return the strategy that will be used for the specified number of organisms
     *
     * @param count		number of organisms to merge
     */
    public Strategy resolve(int count) {
        Strategy retVal = this.strategy;
        if (retVal == Strategy.AUTO)
            retVal = (count > this.sequentialThreshold ? Strategy.SEQUENTIAL : Strategy.BALANCED);
        return retVal;
    }

    /**
     * Merge the models for a list of organisms.
     *
     * @param organisms		names of the organisms to merge
     * @param loader		loader for the organism models; each call must return a fresh model
     *
     * @return the merged community model
     *
     * @throws IOException
     * @throws ModelStructureException if the organism list is empty or an organism was lost
     */
    public MetaModel merge(List<String> organisms, ModelLoader loader) throws IOException {
        final int n = organisms.size();
        if (n == 0)
            throw new ModelStructureException("Cannot build a community with no organisms.");
        Strategy actual = this.resolve(n);
        log.info("Merging {} organism models using {} strategy.", n, actual);
        Node result;
        if (actual == Strategy.SEQUENTIAL)
            result = this.mergeSequential(organisms, loader);
        else
            result = this.mergeBalanced(organisms, loader);
        if (result.members != n)
            throw new ModelStructureException("Merge tree incomplete:  " + result.members + " of " + n
                    + " organisms present in the community.");
        return result.model;
    }

    /**
     * Fold the organism models left to right.
     *
     * @param organisms		names of the organisms to merge
     * @param loader		loader for the organism models
     *
     * @return the merged node
     *
     * @throws IOException
     */
    private Node mergeSequential(List<String> organisms, ModelLoader loader) throws IOException {
        Node retVal = new Node(loader.load(organisms.get(0)), 1);
        final int n = organisms.size();
        for (int i = 1; i < n; i++) {
            retVal.absorb(new Node(loader.load(organisms.get(i)), 1));
            if (log.isDebugEnabled())
                log.debug("{} of {} organisms merged.", i + 1, n);
        }
        return retVal;
    }

    /**
     * Merge the organism models in a balanced binary tree.
     *
     * @param organisms		names of the organisms to merge
     * @param loader		loader for the organism models
     *
     * @return the merged node
     *
     * @throws IOException
     */
    private Node mergeBalanced(List<String> organisms, ModelLoader loader) throws IOException {
        Deque<Node> leftovers = new ArrayDeque<Node>();
        // The first level loads its pairs lazily.
        Level level = this.mergeLevel(organisms.size(), i -> new Node(loader.load(organisms.get(i)), 1));
        int levelNum = 1;
        this.record(level, leftovers, levelNum);
        while (level.merged.size() > 1) {
            final List<Node> nodes = level.merged;
            level = this.mergeLevel(nodes.size(), i -> nodes.get(i));
            levelNum++;
            this.record(level, leftovers, levelNum);
        }
        // A single organism produces no pairs at all.
        Node retVal;
        if (level.merged.isEmpty())
            retVal = leftovers.removeFirst();
        else
            retVal = level.merged.get(0);
        // Fold in the leftovers in the order the levels produced them.
        while (! leftovers.isEmpty())
            retVal.absorb(leftovers.removeFirst());
        log.info("Merge tree completed in {} levels.", levelNum);
        return retVal;
    }

    /**
     * Queue the leftover from a tree level.
     *
     * @param level			tree level just completed
     * @param leftovers		queue of leftovers
     * @param levelNum		level number, for tracing
     */
    private void record(Level level, Deque<Node> leftovers, int levelNum) {
        if (level.single != null)
            leftovers.addLast(level.single);
        log.debug("Merge level {} produced {} models{}.", levelNum, level.merged.size(),
                (level.single == null ? "" : " and one leftover"));
    }

    /**
     * This interface retrieves the node at a position in a level's input.
     */
    @FunctionalInterface
    private interface NodeSource {
        public Node get(int i) throws IOException;
    }

    /**
     * Merge one level of the tree.
     *
     * @param count		number of models in the level
     * @param source	source of the models by position
     *
     * @return the merged pairs and the leftover model
     *
     * @throws IOException
     */
    private Level mergeLevel(int count, NodeSource source) throws IOException {
        final int pairs = count / 2;
        List<Node> merged;
        try {
            if (this.workers <= 1 || pairs <= 1)
                merged = IntStream.range(0, pairs).mapToObj(i -> mergePair(source, i)).collect(Collectors.toList());
            else {
                ForkJoinPool pool = new ForkJoinPool(this.workers);
                try {
                    merged = pool.submit(() -> IntStream.range(0, pairs).parallel()
                            .mapToObj(i -> mergePair(source, i)).collect(Collectors.toList())).get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Merge interrupted.", e);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException)
                        throw (RuntimeException) cause;
                    throw new IOException("Merge failed: " + cause.toString(), cause);
                } finally {
                    pool.shutdown();
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        Node single = null;
        if (count % 2 == 1)
            single = source.get(count - 1);
        return new Level(new ArrayList<Node>(merged), single);
    }

    /**
     * Merge the pair at a given position.
     *
     * @param source	source of the level's models
     * @param i			index of the pair to merge
     *
     * @return the merged node
     */
    private static Node mergePair(NodeSource source, int i) {
        try {
            Node left = source.get(2 * i);
            Node right = source.get(2 * i + 1);
            return left.absorb(right);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
