package edu.brandeis.cosi103a.rankings.pairing;

/**
 * No complete pairing exists for the field, even with every constraint relaxed.
 */
public class PairingImpossibleException extends IllegalStateException {

    public PairingImpossibleException(String message) {
        super(message);
    }
}
