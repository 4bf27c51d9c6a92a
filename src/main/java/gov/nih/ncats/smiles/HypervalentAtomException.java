package gov.nih.ncats.smiles;

/**
 * Thrown by implicit hydrogen inference when the bonds of an atom add up
 * to more than any valence its element permits, as in {@code FC(F)(F)(F)F}.
 * The atom id can be turned into a cursor with
 * {@link gov.nih.ncats.smiles.read.Trace#atom(int)}.
 */
public class HypervalentAtomException extends SmilesException {

	private static final long serialVersionUID = 1L;

	private final int atomId;
	private final int bondOrderSum;

	/**
	 * @param atomId the offending atom, or -1 if the atom was given without an id.
	 * @param bondOrderSum the sum of its bond orders.
	 */
	public HypervalentAtomException(int atomId, int bondOrderSum) {
		super("hypervalent atom " + (atomId<0?"":atomId + " ") + "with bond order sum " + bondOrderSum);
		this.atomId = atomId;
		this.bondOrderSum = bondOrderSum;
	}

	/**
	 * @return the atom id, or -1 if not available.
	 */
	public int getAtomId() {
		return atomId;
	}

	public int getBondOrderSum() {
		return bondOrderSum;
	}
}
