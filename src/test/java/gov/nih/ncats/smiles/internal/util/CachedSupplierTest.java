package gov.nih.ncats.smiles.internal.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

public class CachedSupplierTest {

	@Test
	public void delegateIsCalledOnceOnFirstGet(){
		AtomicInteger calls = new AtomicInteger();
		CachedSupplier<String> s = CachedSupplier.of(()->"v" + calls.incrementAndGet());
		assertFalse(s.hasRun());
		assertEquals(0, calls.get());
		assertEquals("v1", s.get());
		assertEquals("v1", s.get());
		assertTrue(s.hasRun());
		assertEquals(1, calls.get());
	}
}
