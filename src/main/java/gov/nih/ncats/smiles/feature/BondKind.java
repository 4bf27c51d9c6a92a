package gov.nih.ncats.smiles.feature;

import java.util.Optional;

/**
 * The kind of a bond as written in SMILES. {@link #ELIDED} is a bond
 * with no symbol, meaning single or aromatic depending on its atoms.
 * {@link #UP} and {@link #DOWN} are single bonds carrying double bond
 * geometry, and are seen in reverse from the opposite end.
 */
public enum BondKind {
	ELIDED(""),
	SINGLE("-"),
	DOUBLE("="),
	TRIPLE("#"),
	QUADRUPLE("$"),
	AROMATIC(":"),
	UP("/"),
	DOWN("\\");

	private final String symbol;

	BondKind(String symbol){
		this.symbol=symbol;
	}

	public String getSymbol(){
		return this.symbol;
	}

	/**
	 * The kind of this bond when seen from its other end.
	 */
	public BondKind reverse(){
		switch(this){
		case UP:
			return DOWN;
		case DOWN:
			return UP;
		default:
			return this;
		}
	}

	public boolean isDirectional(){
		return this==UP || this==DOWN;
	}

	/**
	 * Bond order used for valence sums. Elided, aromatic and directional
	 * bonds all count as one.
	 */
	public int getOrder(){
		switch(this){
		case DOUBLE:
			return 2;
		case TRIPLE:
			return 3;
		case QUADRUPLE:
			return 4;
		default:
			return 1;
		}
	}

	/**
	 * Reconcile the two ends of a ring closure. Each kind is given from the
	 * perspective of its own end, so a compatible directional pair is one
	 * {@link #UP} and one {@link #DOWN}.
	 *
	 * @param left the kind written at the opening ring bond number.
	 * @param right the kind written at the closing ring bond number.
	 * @return the resolved pair (left end, right end), or empty if the two
	 * kinds conflict.
	 */
	public static Optional<BondKind[]> reconcile(BondKind left, BondKind right){
		if(left==right){
			if(left.isDirectional()){
				return Optional.empty();
			}
			return Optional.of(new BondKind[]{left,right});
		}
		if(left.isDirectional() && right.isDirectional()){
			return Optional.of(new BondKind[]{left,right});
		}
		if(left==ELIDED){
			return Optional.of(new BondKind[]{right.reverse(),right});
		}
		if(right==ELIDED){
			return Optional.of(new BondKind[]{left,left.reverse()});
		}
		return Optional.empty();
	}

	/**
	 * Look up a bond kind from its one character symbol.
	 * @param c the character
	 * @return the kind or empty if c is not a bond symbol.
	 */
	public static Optional<BondKind> fromSymbol(int c){
		switch(c){
		case '-':
			return Optional.of(SINGLE);
		case '=':
			return Optional.of(DOUBLE);
		case '#':
			return Optional.of(TRIPLE);
		case '$':
			return Optional.of(QUADRUPLE);
		case ':':
			return Optional.of(AROMATIC);
		case '/':
			return Optional.of(UP);
		case '\\':
			return Optional.of(DOWN);
		default:
			return Optional.empty();
		}
	}
}
