package gov.nih.ncats.smiles.write;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import gov.nih.ncats.smiles.SmilesWriterOptions;
import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;
import gov.nih.ncats.smiles.graph.Atom;
import gov.nih.ncats.smiles.graph.Bond;
import gov.nih.ncats.smiles.graph.ConnectionTable;

/**
 * Writes a {@link ConnectionTable} as SMILES by walking a depth first
 * spanning tree.
 * <p>
 * Neighbors are explored in the order of each atom's bond list. Bonds to
 * atoms not yet seen become branches, with the last one continuing the
 * chain; bonds back to atoms already seen become ring bonds, numbered
 * with the lowest free number. Atoms not reached from the start atom are
 * written as further {@code .} separated components, in id order.
 * <p>
 * The text reads back to the same graph up to atom order, which
 * {@link Writing#getOrder()} gives. It is not canonical. Tetrahedral
 * markers are inverted where the written neighbor order is an odd
 * permutation of {@link Atom#getNeighborOrder()}, so {@code @} and
 * {@code @@} keep their meaning from any start atom.
 */
public class SmilesWriter {

	private final ConnectionTable ct;
	private final SmilesWriterOptions options;

	/** mate[a][j] is the index at the target of the other end of bond j of atom a. */
	private int[][] mate;
	private boolean[][] used;
	private boolean[] visited;
	private List<List<Integer>> children;
	private List<List<Integer>> rings;
	private int[][] ringNumber;

	public SmilesWriter(ConnectionTable ct){
		this(ct, null);
	}

	/**
	 * @param options the options to use; if null, the defaults are used.
	 */
	public SmilesWriter(ConnectionTable ct, SmilesWriterOptions options){
		this.ct=Objects.requireNonNull(ct);
		this.options=Optional.ofNullable(options).orElseGet(SmilesWriterOptions::new);
	}

	/**
	 * @throws IllegalArgumentException if the start atom does not exist, or
	 * the graph has a bond to an unknown atom, a bond from an atom to
	 * itself, or a bond stored at only one end.
	 * @throws IllegalStateException if more than 99 ring bonds would be open at once.
	 */
	public Writing write(){
		int n = ct.getAtomCount();
		int start = options.getStartAtom();
		if(n==0 && start==0){
			return new Writing("", new int[0]);
		}
		if(start<0 || start>=n){
			throw new IllegalArgumentException("start atom " + start + " not in graph of " + n + " atoms");
		}
		pairBonds();

		visited = new boolean[n];
		used = new boolean[n][];
		ringNumber = new int[n][];
		children = new ArrayList<>(n);
		rings = new ArrayList<>(n);
		for(int i=0;i<n;i++){
			int size = ct.getAtom(i).getBondCount();
			used[i] = new boolean[size];
			ringNumber[i] = new int[size];
			children.add(new ArrayList<>());
			rings.add(new ArrayList<>());
		}

		StringBuilder sb = new StringBuilder();
		List<Integer> order = new ArrayList<>(n);
		RingNumberPool pool = new RingNumberPool();
		component(start, order, sb, pool);
		for(int i=0;i<n;i++){
			if(!visited[i]){
				sb.append('.');
				component(i, order, sb, pool);
			}
		}
		return new Writing(sb.toString(), order.stream().mapToInt(Integer::intValue).toArray());
	}

	private void component(int start, List<Integer> order, StringBuilder sb, RingNumberPool pool){
		int first = order.size();
		span(start, order);
		for(int i=first;i<order.size();i++){
			rings.get(order.get(i)).sort(null);
		}
		emit(start, sb, pool);
	}

	/**
	 * Match every bond end with its other end, checking the graph is well formed.
	 */
	private void pairBonds(){
		int n = ct.getAtomCount();
		mate = new int[n][];
		for(int a=0;a<n;a++){
			mate[a] = new int[ct.getAtom(a).getBondCount()];
			Arrays.fill(mate[a], -1);
		}
		for(int a=0;a<n;a++){
			List<Bond> bonds = ct.getAtom(a).getBonds();
			for(int j=0;j<bonds.size();j++){
				if(mate[a][j]>=0){
					continue;
				}
				Bond b = bonds.get(j);
				int t = b.getTarget();
				if(t<0 || t>=n){
					throw new IllegalArgumentException("atom " + a + " is bonded to unknown atom " + t);
				}
				if(t==a){
					throw new IllegalArgumentException("atom " + a + " is bonded to itself");
				}
				List<Bond> other = ct.getAtom(t).getBonds();
				int k=0;
				for(;k<other.size();k++){
					Bond o = other.get(k);
					if(mate[t][k]<0 && o.getTarget()==a && o.getKind()==b.getKind().reverse()){
						break;
					}
				}
				if(k==other.size()){
					throw new IllegalArgumentException("bond " + a + b.getKind().getSymbol() + t + " is missing at atom " + t);
				}
				mate[a][j]=k;
				mate[t][k]=j;
			}
		}
	}

	/**
	 * Depth first walk deciding, for every bond, whether it is a tree bond
	 * or a ring bond.
	 */
	private void span(int start, List<Integer> order){
		Deque<int[]> stack = new ArrayDeque<>();
		visited[start]=true;
		order.add(start);
		stack.push(new int[]{start,0});
		while(!stack.isEmpty()){
			int[] frame = stack.peek();
			int a = frame[0];
			List<Bond> bonds = ct.getAtom(a).getBonds();
			if(frame[1]>=bonds.size()){
				stack.pop();
				continue;
			}
			int j = frame[1]++;
			if(used[a][j]){
				continue;
			}
			int t = bonds.get(j).getTarget();
			int k = mate[a][j];
			used[a][j]=true;
			used[t][k]=true;
			if(!visited[t]){
				visited[t]=true;
				order.add(t);
				children.get(a).add(j);
				stack.push(new int[]{t,0});
			}else{
				//t was written first and opens the ring
				rings.get(t).add(k);
				rings.get(a).add(j);
			}
		}
	}

	private void emit(int start, StringBuilder sb, RingNumberPool pool){
		//an int[] is an atom with the bond index it was reached through, a String is literal text
		Deque<Object> tasks = new ArrayDeque<>();
		tasks.push(new int[]{start,-1,-1});
		while(!tasks.isEmpty()){
			Object task = tasks.pop();
			if(task instanceof String){
				sb.append((String)task);
				continue;
			}
			int[] t = (int[])task;
			int a = t[0];
			Atom atom = ct.getAtom(a);
			int back = -1;
			if(t[1]>=0){
				Atom parent = ct.getAtom(t[1]);
				BondKind kind = parent.getBonds().get(t[2]).getKind();
				sb.append(SmilesFormat.bond(kind, parent.getKind(), atom.getKind()));
				back = mate[t[1]][t[2]];
			}
			sb.append(atomText(atom, back));
			writeRingNumbers(a, sb, pool);

			List<Integer> branches = children.get(a);
			for(int i=branches.size()-1;i>=0;i--){
				int j = branches.get(i);
				int target = atom.getBonds().get(j).getTarget();
				if(i==branches.size()-1){
					tasks.push(new int[]{target,a,j});
				}else{
					tasks.push(")");
					tasks.push(new int[]{target,a,j});
					tasks.push("(");
				}
			}
		}
	}

	private void writeRingNumbers(int a, StringBuilder sb, RingNumberPool pool){
		Atom atom = ct.getAtom(a);
		List<Integer> closing = new ArrayList<>();
		for(int j : rings.get(a)){
			Bond b = atom.getBonds().get(j);
			int t = b.getTarget();
			int k = mate[a][j];
			if(ringNumber[t][k]==0){
				int number = pool.allocate();
				ringNumber[a][j]=number;
				sb.append(SmilesFormat.bond(b.getKind(), atom.getKind(), ct.getAtom(t).getKind()));
				sb.append(SmilesFormat.ringNumber(number));
			}else{
				int number = ringNumber[t][k];
				sb.append(SmilesFormat.ringNumber(number));
				closing.add(number);
			}
		}
		closing.forEach(pool::free);
	}

	private String atomText(Atom atom, int back){
		AtomKind kind = atom.getKind();
		if(kind.getConfiguration().isPresent() && isOddPermutation(atom.getNeighborOrder(), writtenOrder(atom, back))){
			kind = kind.invertConfiguration();
		}
		if(!options.isDebracket()){
			return SmilesFormat.atom(kind);
		}
		List<BondKind> kinds = atom.getBonds().stream()
				.map(Bond::getKind)
				.collect(Collectors.toList());
		return SmilesFormat.atom(kind, kinds, true);
	}

	/**
	 * The neighbors of an atom in the order the reader will see them: the
	 * bond it is reached through, its bracket hydrogen, its ring bonds and
	 * then its branches.
	 */
	private int[] writtenOrder(Atom atom, int back){
		int[] stored = atom.getNeighborOrder();
		int[] order = new int[stored.length];
		int i=0;
		if(back>=0){
			order[i++]=back;
		}
		if(stored.length>atom.getBondCount()){
			order[i++]=Atom.IMPLICIT_HYDROGEN;
		}
		for(int j : rings.get(atom.getId())){
			order[i++]=j;
		}
		for(int j : children.get(atom.getId())){
			order[i++]=j;
		}
		return order;
	}

	/**
	 * @param from distinct values.
	 * @param to the same values in another order.
	 */
	static boolean isOddPermutation(int[] from, int[] to){
		Map<Integer,Integer> position = new HashMap<>();
		for(int i=0;i<from.length;i++){
			position.put(from[i], i);
		}
		int inversions=0;
		for(int i=0;i<to.length;i++){
			for(int j=i+1;j<to.length;j++){
				if(position.get(to[i])>position.get(to[j])){
					inversions++;
				}
			}
		}
		return inversions%2==1;
	}
}
