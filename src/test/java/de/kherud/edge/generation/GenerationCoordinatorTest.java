package de.kherud.edge.generation;

import de.kherud.edge.GenerationFailureException;
import de.kherud.edge.ModelFamily;
import de.kherud.edge.engine.FakeNativeEngine;
import de.kherud.edge.engine.NativeEngineHandle;
import de.kherud.edge.memory.MemorySnapshot;
import de.kherud.edge.request.Operation;
import de.kherud.edge.request.TextRequest;
import de.kherud.edge.request.TextResult;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class GenerationCoordinatorTest {

	private static final long MB = 1024L * 1024L;

	private FakeNativeEngine engine;
	private GenerationCoordinator coordinator;

	@Before
	public void setUp() {
		engine = new FakeNativeEngine();
		coordinator = new GenerationCoordinator(Runnable::run);
	}

	private static GenerationMetrics metrics(Operation operation) {
		return new GenerationMetrics(() -> new MemorySnapshot(8192 * MB, 4096 * MB, 0, 512 * MB),
			ModelFamily.TEXT, operation, false, "EAGER");
	}

	@Test
	public void testSuccessfulGeneration() {
		NativeEngineHandle handle = engine.newHandle(ModelFamily.TEXT, "smollm.gguf");
		List<Integer> steps = new ArrayList<>();

		GenerationOutcome<TextResult> outcome = coordinator.withGenerationLock(ModelFamily.TEXT, () ->
			coordinator.generate(ModelFamily.TEXT, handle, TextRequest.of("hello"), (step, total) -> steps.add(step),
				metrics(Operation.COMPLETION)));

		assertTrue(outcome.isSuccess());
		assertEquals("generated", outcome.getOrThrow().text());
		assertEquals(List.of(1, 2, 3), steps);
		assertEquals(3, outcome.getMetrics().orElseThrow().steps());
		assertEquals(3, outcome.getMetrics().orElseThrow().unitsProduced());
		assertFalse(coordinator.isGenerating(ModelFamily.TEXT));
	}

	@Test
	public void testCancellationIsForwardedOnce() {
		NativeEngineHandle handle = engine.newHandle(ModelFamily.TEXT, "smollm.gguf");
		AtomicBoolean firstCancel = new AtomicBoolean();
		AtomicBoolean secondCancel = new AtomicBoolean(true);
		ProgressListener listener = (step, total) -> {
			if (step == 1) {
				firstCancel.set(coordinator.cancelGeneration(ModelFamily.TEXT));
				secondCancel.set(coordinator.cancelGeneration(ModelFamily.TEXT));
			}
		};

		GenerationOutcome<TextResult> outcome = coordinator.withGenerationLock(ModelFamily.TEXT, () ->
			coordinator.generate(ModelFamily.TEXT, handle, TextRequest.of("hello"), listener, metrics(Operation.COMPLETION)));

		assertTrue(firstCancel.get());
		assertFalse(secondCancel.get());
		assertEquals(1, engine.cancelCount(handle.getPointer()));
		assertEquals(GenerationOutcome.Status.CANCELLED, outcome.getStatus());
		assertFalse(outcome.getResult().isPresent());
		assertEquals(1, outcome.getMetrics().orElseThrow().steps());
	}

	@Test
	public void testCancelWithoutActiveSession() {
		assertFalse(coordinator.cancelGeneration(ModelFamily.VIDEO_DIFFUSION));
		assertEquals(0, coordinator.cancelGeneration());
	}

	@Test
	public void testEngineFailureBecomesFailedOutcome() {
		NativeEngineHandle handle = engine.newHandle(ModelFamily.TEXT, "smollm.gguf");
		engine.setFailGenerations(true);

		GenerationOutcome<TextResult> outcome = coordinator.withGenerationLock(ModelFamily.TEXT, () ->
			coordinator.generate(ModelFamily.TEXT, handle, TextRequest.of("hello"), ProgressListener.NONE,
				metrics(Operation.COMPLETION)));

		assertTrue(outcome.isFailed());
		assertTrue(outcome.getErrorMessage().orElseThrow().contains("scripted failure"));
		try {
			outcome.getOrThrow();
			fail("Expected GenerationFailureException");
		}
		catch (GenerationFailureException e) {
			assertTrue(e.getMessage().contains("returned no result"));
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testGenerateRequiresFamilyLock() {
		NativeEngineHandle handle = engine.newHandle(ModelFamily.TEXT, "smollm.gguf");
		coordinator.generate(ModelFamily.TEXT, handle, TextRequest.of("hello"), ProgressListener.NONE,
			metrics(Operation.COMPLETION));
	}

	@Test
	public void testSameFamilyIsMutuallyExclusive() throws Exception {
		AtomicInteger inside = new AtomicInteger();
		AtomicInteger maxInside = new AtomicInteger();
		ExecutorService pool = Executors.newFixedThreadPool(6);
		try {
			List<Future<Integer>> futures = new ArrayList<>();
			for (int i = 0; i < 12; i++) {
				futures.add(pool.submit(() -> coordinator.withGenerationLock(ModelFamily.IMAGE_DIFFUSION, () -> {
					int now = inside.incrementAndGet();
					maxInside.accumulateAndGet(now, Math::max);
					try {
						Thread.sleep(5);
					}
					catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
					inside.decrementAndGet();
					return now;
				})));
			}
			for (Future<Integer> future : futures) {
				future.get(10, TimeUnit.SECONDS);
			}
		}
		finally {
			pool.shutdownNow();
		}
		assertEquals(1, maxInside.get());
	}

	@Test
	public void testDifferentFamiliesDoNotBlockEachOther() throws Exception {
		CountDownLatch textLocked = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		Thread holder = new Thread(() -> coordinator.withGenerationLock(ModelFamily.TEXT, () -> {
			textLocked.countDown();
			try {
				release.await(10, TimeUnit.SECONDS);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			return null;
		}));
		holder.start();
		try {
			assertTrue(textLocked.await(10, TimeUnit.SECONDS));
			assertTrue(coordinator.isLocked(ModelFamily.TEXT));

			boolean ran = coordinator.withGenerationLock(ModelFamily.TRANSCRIPTION, () -> true);
			assertTrue(ran);
		}
		finally {
			release.countDown();
			holder.join(10_000);
		}
		assertFalse(coordinator.isLocked(ModelFamily.TEXT));
	}
}
