package gov.nih.ncats.smiles;

/**
 * Base class of every failure to read, convert or interpret SMILES.
 */
public class SmilesException extends Exception {

	private static final long serialVersionUID = 1L;

	public SmilesException(String message) {
		super(message);
	}

	public SmilesException(String message, Throwable cause) {
		super(message, cause);
	}
}
