package gov.nih.ncats.smiles.read;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import gov.nih.ncats.smiles.tree.BranchNode;
import gov.nih.ncats.smiles.tree.RingBond;

/**
 * The result of reading SMILES text: one tree per disconnected component,
 * the ring bonds resolved along the way, and the trace if one was kept.
 */
public final class Reading {

	private final String text;
	private final List<BranchNode> roots;
	private final List<RingBond> ringBonds;
	private final int atomCount;
	private final Trace trace;

	Reading(String text, List<BranchNode> roots, List<RingBond> ringBonds, int atomCount, Trace trace){
		this.text=text;
		this.roots=Collections.unmodifiableList(roots);
		this.ringBonds=Collections.unmodifiableList(ringBonds);
		this.atomCount=atomCount;
		this.trace=trace;
	}

	public String getText() {
		return text;
	}

	/**
	 * Roots in text order, one per {@code .} separated component.
	 */
	public List<BranchNode> getRoots() {
		return roots;
	}

	/**
	 * The root of a connected reading.
	 * @throws IllegalStateException if the text has more than one component.
	 */
	public BranchNode getRoot(){
		if(roots.size()!=1){
			throw new IllegalStateException("text has " + roots.size() + " components");
		}
		return roots.get(0);
	}

	public boolean isConnected(){
		return roots.size()==1;
	}

	/**
	 * Ring bonds in the order they were closed.
	 */
	public List<RingBond> getRingBonds() {
		return ringBonds;
	}

	public int getAtomCount() {
		return atomCount;
	}

	public Optional<Trace> getTrace() {
		return Optional.ofNullable(trace);
	}
}
