package gov.nih.ncats.smiles.graph;

import java.util.Objects;

import gov.nih.ncats.smiles.feature.BondKind;

/**
 * One end of a bond, as stored in an {@link Atom}'s bond list.
 * The other end is stored at the target atom.
 */
public final class Bond {

	private final BondKind kind;
	private final int target;

	public Bond(BondKind kind, int target){
		this.kind=Objects.requireNonNull(kind);
		this.target=target;
	}

	/**
	 * The kind seen from the atom holding this end.
	 */
	public BondKind getKind() {
		return kind;
	}

	public int getTarget() {
		return target;
	}

	@Override
	public boolean equals(Object o){
		if(this==o){
			return true;
		}
		if(!(o instanceof Bond)){
			return false;
		}
		Bond other=(Bond)o;
		return kind==other.kind && target==other.target;
	}

	@Override
	public int hashCode(){
		return 31*kind.hashCode() + target;
	}

	@Override
	public String toString(){
		return "Bond{" + kind + " -> " + target + "}";
	}
}
