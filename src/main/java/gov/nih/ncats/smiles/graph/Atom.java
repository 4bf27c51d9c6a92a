package gov.nih.ncats.smiles.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;

/**
 * An atom of a {@link ConnectionTable}. Neighbors are referenced by id,
 * never by object, so rings need no back pointers.
 */
public final class Atom {

	/** Stands for the single bracket hydrogen in {@link #getNeighborOrder()}. */
	public static final int IMPLICIT_HYDROGEN = -1;

	private final int id;
	private final AtomKind kind;
	private final List<Bond> bonds = new ArrayList<>();

	Atom(int id, AtomKind kind){
		this.id=id;
		this.kind=Objects.requireNonNull(kind);
	}

	public int getId() {
		return id;
	}

	public AtomKind getKind() {
		return kind;
	}

	public List<Bond> getBonds(){
		return Collections.unmodifiableList(bonds);
	}

	public int getBondCount(){
		return bonds.size();
	}

	/**
	 * Append a single end of a bond to this atom only. Most callers want
	 * {@link ConnectionTable#addBond(int, BondKind, int)}, which keeps both
	 * ends in step.
	 */
	public Atom addBond(BondKind kind, int target){
		bonds.add(new Bond(kind, target));
		return this;
	}

	/**
	 * The order in which a chirality marker on this atom lists its
	 * neighbors: bond indices in bond list order, with
	 * {@link #IMPLICIT_HYDROGEN} for the hydrogen of {@code [C@H]}. That
	 * hydrogen comes right after the first bond when the first bond leads to
	 * a lower id, as it does for every atom but the first of a parsed
	 * component, and before all bonds otherwise.
	 */
	public int[] getNeighborOrder(){
		boolean hydrogen = kind.getHcount().isPresent() && kind.getHcount().getAsInt()==1;
		int[] order = new int[bonds.size() + (hydrogen?1:0)];
		int i=0;
		for(int j=0;j<bonds.size();j++){
			if(hydrogen && i==(bonds.get(0).getTarget()<id?1:0)){
				order[i++]=IMPLICIT_HYDROGEN;
			}
			order[i++]=j;
		}
		if(i<order.length){
			order[i]=IMPLICIT_HYDROGEN;
		}
		return order;
	}

	/**
	 * The first bond from this atom to the given atom id, if any.
	 */
	public Optional<Bond> getBondTo(int target){
		return bonds.stream()
				.filter(b->b.getTarget()==target)
				.findFirst();
	}

	public boolean connectsTo(int target){
		return getBondTo(target).isPresent();
	}

	@Override
	public String toString(){
		return "Atom{" + id + " " + kind + " " + bonds + "}";
	}
}
