package de.kherud.edge.generation;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CancellationTokenTest {

	@Test
	public void testStateOnlyMovesForward() {
		CancellationToken token = new CancellationToken();
		assertEquals(CancellationToken.State.NOT_REQUESTED, token.getState());

		token.acknowledge();
		assertEquals(CancellationToken.State.NOT_REQUESTED, token.getState());

		assertTrue(token.request());
		assertFalse(token.request());
		assertTrue(token.isCancellationRequested());

		token.acknowledge();
		assertEquals(CancellationToken.State.ACKNOWLEDGED, token.getState());
		assertFalse(token.request());
		assertTrue(token.isCancellationRequested());
	}
}
