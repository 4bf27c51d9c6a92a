package gov.nih.ncats.smiles.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;
import gov.nih.ncats.smiles.read.Trace;

/**
 * A molecule as a flat list of atoms indexed by id 0..N-1, each holding
 * its own ends of its bonds. Every bond is stored once at each end; a
 * directional kind is stored reversed at the far end.
 * <p>
 * Tables built by {@link GraphBuilder} number atoms in the order they
 * appear in the SMILES text.
 */
public class ConnectionTable{

	private final List<Atom> atoms = new ArrayList<>();
	private Trace trace;

	public Atom addAtom(AtomKind kind){
		Atom a = new Atom(atoms.size(), kind);
		atoms.add(a);
		return a;
	}

	/**
	 * Add a bond at both ends. The target end gets the reverse of
	 * {@code kind}, so {@code addBond(0, UP, 1)} matches {@code 0/1}.
	 * @throws IllegalArgumentException if either id is unknown or they are equal.
	 */
	public ConnectionTable addBond(int source, BondKind kind, int target){
		checkId(source);
		checkId(target);
		if(source==target){
			throw new IllegalArgumentException("atom " + source + " can not bond to itself");
		}
		atoms.get(source).addBond(kind, target);
		atoms.get(target).addBond(kind.reverse(), source);
		return this;
	}

	private void checkId(int id){
		if(id<0 || id>=atoms.size()){
			throw new IllegalArgumentException("no atom with id " + id);
		}
	}

	/**
	 * @throws IndexOutOfBoundsException if the id is unknown.
	 */
	public Atom getAtom(int id){
		return atoms.get(id);
	}

	public List<Atom> getAtoms(){
		return Collections.unmodifiableList(atoms);
	}

	public int getAtomCount(){
		return atoms.size();
	}

	/**
	 * Number of bonds, counting each bond once.
	 */
	public int getBondCount(){
		return atoms.stream().mapToInt(Atom::getBondCount).sum()/2;
	}

	/**
	 * The trace of the parse this table was built from, if one was kept.
	 */
	public Optional<Trace> getTrace(){
		return Optional.ofNullable(trace);
	}

	ConnectionTable setTrace(Trace trace){
		this.trace=trace;
		return this;
	}

	@Override
	public String toString(){
		return "ConnectionTable{atoms=" + atoms.size() + ", bonds=" + getBondCount() + "}";
	}
}
