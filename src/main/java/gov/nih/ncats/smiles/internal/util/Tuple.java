package gov.nih.ncats.smiles.internal.util;

import java.util.Objects;

/**
 * An immutable pair. Equal when both elements are equal, in order.
 *
 * @param <K>
 * @param <V>
 */
public final class Tuple<K,V>{
	private final K k;
	private final V v;

	public Tuple(K k,V v){
		this.k=k;
		this.v=v;
	}

	public K k(){
		return k;
	}

	public V v(){
		return v;
	}

	public static <K,V> Tuple<K,V> of(K k, V v){
		return new Tuple<K,V>(k,v);
	}

	@Override
	public int hashCode(){
		return 31*Objects.hashCode(k) + Objects.hashCode(v);
	}

	@Override
	public boolean equals(Object o){
		if(!(o instanceof Tuple)){
			return false;
		}
		Tuple<?,?> tup2 = (Tuple<?,?>)o;
		return Objects.equals(tup2.k, this.k) && Objects.equals(tup2.v, this.v);
	}

	@Override
	public String toString(){
		return "<" + k + "," + v + ">";
	}
}
