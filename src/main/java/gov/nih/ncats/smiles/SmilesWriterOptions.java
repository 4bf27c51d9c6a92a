package gov.nih.ncats.smiles;

/**
 * Options for writing a {@link gov.nih.ncats.smiles.graph.ConnectionTable}
 * as SMILES.
 */
public class SmilesWriterOptions {

	private int startAtom = 0;
	private boolean debracket = false;

	/**
	 * The atom id to start writing from. Default is 0.
	 * @param startAtom the atom id; checked against the graph when writing.
	 * @return this
	 */
	public SmilesWriterOptions startAtom(int startAtom){
		this.startAtom=startAtom;
		return this;
	}

	/**
	 * Write bracket atoms in their short form when nothing is lost by
	 * doing so, as {@code C} for {@code [CH4]}. Default is false, which
	 * writes every bracket atom as it was read.
	 * @return this
	 */
	public SmilesWriterOptions debracket(boolean debracket){
		this.debracket=debracket;
		return this;
	}

	public int getStartAtom() {
		return startAtom;
	}

	public boolean isDebracket() {
		return debracket;
	}
}
