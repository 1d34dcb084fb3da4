/**
 *
 */
package org.theseed.community;

/**
 * This exception is thrown when a model violates a structural requirement: a reaction references
 * an unknown metabolite, an identifier is duplicated, a required reaction is missing, or a merge
 * would leave the community incomplete.
 */
public class ModelStructureException extends RuntimeException {

    /** serialization version ID */
    private static final long serialVersionUID = -3016845283764091542L;

    public ModelStructureException(String message) {
        super(message);
    }

}
