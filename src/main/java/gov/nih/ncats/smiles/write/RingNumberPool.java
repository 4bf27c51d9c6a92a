package gov.nih.ncats.smiles.write;

import java.util.BitSet;
import java.util.logging.Logger;

/**
 * Hands out the lowest ring bond number not currently open, from 1 to 99.
 */
public class RingNumberPool {

	private static final Logger logger = Logger.getLogger(RingNumberPool.class.getName());

	public static final int MAX = 99;

	private final BitSet inUse = new BitSet(MAX+1);

	/**
	 * @throws IllegalStateException if all 99 numbers are open.
	 */
	public int allocate(){
		int n = inUse.nextClearBit(1);
		if(n>MAX){
			throw new IllegalStateException("more than " + MAX + " ring bonds open at once");
		}
		inUse.set(n);
		logger.finer("allocated ring bond number " + n);
		return n;
	}

	/**
	 * @throws IllegalArgumentException if n is not open.
	 */
	public void free(int n){
		if(n<1 || n>MAX || !inUse.get(n)){
			throw new IllegalArgumentException("ring bond number " + n + " is not open");
		}
		inUse.clear(n);
		logger.finer("freed ring bond number " + n);
	}

	public int getOpenCount(){
		return inUse.cardinality();
	}

	public boolean isOpen(int n){
		return n>=1 && n<=MAX && inUse.get(n);
	}
}
