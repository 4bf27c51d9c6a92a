package gov.nih.ncats.smiles.read;

/**
 * The grammar terminals a {@link Scanner} can see next, outside of
 * bracket atoms.
 */
public enum Terminal {
	/** {@code *}, or an organic or aromatic subset symbol. */
	ATOM,
	BRACKET_OPEN,
	BOND,
	/** a digit or {@code %} */
	RING_BOND,
	BRANCH_OPEN,
	BRANCH_CLOSE,
	DOT,
	END,
	INVALID
}
