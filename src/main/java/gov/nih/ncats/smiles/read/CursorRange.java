package gov.nih.ncats.smiles.read;

/**
 * A half open range [start, end) of character offsets into SMILES text.
 */
public final class CursorRange {

	private final int start;
	private final int end;

	private CursorRange(int start, int end){
		this.start=start;
		this.end=end;
	}

	/**
	 * @throws IllegalArgumentException if start is negative or end is before start.
	 */
	public static CursorRange of(int start, int end){
		if(start<0 || end<start){
			throw new IllegalArgumentException("bad range [" + start + "," + end + ")");
		}
		return new CursorRange(start, end);
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int length(){
		return end-start;
	}

	/**
	 * The part of the given text this range covers.
	 */
	public String of(String text){
		return text.substring(start, end);
	}

	@Override
	public boolean equals(Object o){
		if(this==o){
			return true;
		}
		if(!(o instanceof CursorRange)){
			return false;
		}
		CursorRange other=(CursorRange)o;
		return start==other.start && end==other.end;
	}

	@Override
	public int hashCode(){
		return 31*start + end;
	}

	@Override
	public String toString(){
		return "[" + start + "," + end + ")";
	}
}
