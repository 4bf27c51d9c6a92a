package gov.nih.ncats.smiles.internal.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.junit.Test;

public class TupleTest {

	@Test
	public void equalityIsOrdered(){
		assertEquals(Tuple.of(1, 2), Tuple.of(1, 2));
		assertEquals(Tuple.of(1, 2).hashCode(), Tuple.of(1, 2).hashCode());
		assertEquals(Integer.valueOf(1), Tuple.of(1, 2).k());
		assertEquals(Integer.valueOf(2), Tuple.of(1, 2).v());
		assertNotEquals(Tuple.of(1, 2), Tuple.of(2, 1));
	}
}
