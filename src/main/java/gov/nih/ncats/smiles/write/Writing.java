package gov.nih.ncats.smiles.write;

/**
 * Text written for a graph, plus the order its atoms were written in.
 * Reading the text back gives atom {@code i} for graph atom {@code getOrder()[i]}.
 */
public final class Writing {

	private final String text;
	private final int[] order;

	Writing(String text, int[] order){
		this.text=text;
		this.order=order;
	}

	public String getText() {
		return text;
	}

	public int[] getOrder() {
		return order.clone();
	}

	@Override
	public String toString(){
		return text;
	}
}
