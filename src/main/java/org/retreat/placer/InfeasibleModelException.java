package org.retreat.placer;

/**
 * The solver returned no solution at all. Leaving everybody unassigned always
 * satisfies the hard constraints, so this points at a broken model.
 */
public class InfeasibleModelException extends PlacementException {

    public InfeasibleModelException(String message) {
        super(message);
    }
}
