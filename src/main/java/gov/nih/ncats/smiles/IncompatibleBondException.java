package gov.nih.ncats.smiles;

/**
 * Thrown when the two ends of a ring closure specify bond kinds that can
 * not describe the same bond, as in {@code C=1CCCCC#1}.
 */
public class IncompatibleBondException extends SmilesException {

	private static final long serialVersionUID = 1L;

	private final int cursor;
	private final int sourceId;
	private final int targetId;

	/**
	 * @param cursor offset of the closing token, or -1 if the conflict was
	 * found outside of parsing.
	 * @param sourceId the atom where the ring bond was opened.
	 * @param targetId the atom where the ring bond was closed.
	 */
	public IncompatibleBondException(int cursor, int sourceId, int targetId) {
		super("incompatible bond kinds between atoms " + sourceId + " and " + targetId
				+ (cursor<0?"":" at offset " + cursor));
		this.cursor = cursor;
		this.sourceId = sourceId;
		this.targetId = targetId;
	}

	/**
	 * @return the offset of the closing ring bond token, or -1 if not available.
	 */
	public int getCursor() {
		return cursor;
	}

	public int getSourceId() {
		return sourceId;
	}

	public int getTargetId() {
		return targetId;
	}
}
