package gov.nih.ncats.smiles;

/**
 * Thrown when SMILES text does not follow the grammar.
 * <p>
 * The cursor is a zero-based character offset into the text. For
 * {@link Reason#END_OF_INPUT} it is the length of the text, and for
 * {@link Reason#UNBALANCED_RING_BOND} it is the offset of the ring bond
 * number that was never closed.
 */
public class SmilesSyntaxException extends SmilesException {

	private static final long serialVersionUID = 1L;

	public enum Reason{
		INVALID_CHARACTER("invalid character"),
		END_OF_INPUT("unexpected end of input"),
		UNBALANCED_RING_BOND("unbalanced ring bond"),
		DUPLICATE_RING_BOND("duplicate ring bond");

		private final String description;

		Reason(String description){
			this.description=description;
		}

		public String getDescription(){
			return this.description;
		}
	}

	private final Reason reason;
	private final int cursor;

	public SmilesSyntaxException(Reason reason, int cursor) {
		super(reason.getDescription() + " at offset " + cursor);
		this.reason = reason;
		this.cursor = cursor;
	}

	public Reason getReason() {
		return reason;
	}

	public int getCursor() {
		return cursor;
	}
}
