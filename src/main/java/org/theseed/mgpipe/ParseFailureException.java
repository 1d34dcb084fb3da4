/**
 *
 */
package org.theseed.mgpipe;

/**
 * This exception is thrown when a command's parameters are invalid.
 */
public class ParseFailureException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = -2387713591584725012L;

    public ParseFailureException(String message) {
        super(message);
    }

}
