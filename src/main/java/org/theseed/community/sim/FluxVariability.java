/**
 *
 */
package org.theseed.community.sim;

import java.util.Collection;
import java.util.Map;

import org.theseed.community.MetaModel;

/**
 * This interface computes the range of fluxes each of a set of reactions can carry while the
 * model objective stays near its optimum.
 */
public interface FluxVariability {

    /**
     * @return a map of reaction IDs to flux ranges
     *
     * @param model			constrained model to analyze
     * @param reactionIds	IDs of the reactions of interest
     */
    public Map<String, FluxRange> compute(MetaModel model, Collection<String> reactionIds);

}
