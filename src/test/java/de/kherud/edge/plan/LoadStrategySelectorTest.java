package de.kherud.edge.plan;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.memory.MemorySnapshot;
import org.junit.Test;

import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LoadStrategySelectorTest {

	private static final long MB = 1024L * 1024L;
	private static final long GB = 1024L * MB;

	private final LoadStrategySelector selector = new LoadStrategySelector(CpuTopology.of(8, 8));

	private static MemorySnapshot roomy() {
		return new MemorySnapshot(16 * GB, 12 * GB, 100 * MB, 4 * GB);
	}

	@Test
	public void testEagerWhenMemoryIsPlentiful() {
		LoadPlan plan = selector.selectPlan(1 * GB, roomy(), false, null);

		assertEquals(LoadPlan.Strategy.EAGER, plan.strategy());
		assertFalse(plan.offloadToCpu());
		assertEquals("sufficient memory", plan.reason());
	}

	@Test
	public void testStagedWhenModelExceedsAvailableShare() {
		LoadPlan plan = selector.selectPlan(8 * GB, roomy(), false, null);

		assertTrue(plan.isStaged());
		assertTrue(plan.reason().contains("60%"));
	}

	@Test
	public void testStagedOnLowMemoryDevice() {
		MemorySnapshot snapshot = new MemorySnapshot(6 * GB, 4 * GB, 100 * MB, 4 * GB);
		assertTrue(selector.selectPlan(100 * MB, snapshot, false, null).isStaged());
	}

	@Test
	public void testStagedWhenHeapHeadroomIsShort() {
		MemorySnapshot snapshot = new MemorySnapshot(16 * GB, 12 * GB, 900 * MB, 1 * GB);

		LoadPlan plan = selector.selectPlan(200 * MB, snapshot, false, null);

		assertTrue(plan.isStaged());
		assertTrue(plan.reason().startsWith("heap headroom"));
	}

	@Test
	public void testPreferPerformanceOnlyHonoursSevereSignals() {
		MemorySnapshot shortHeap = new MemorySnapshot(16 * GB, 12 * GB, 900 * MB, 1 * GB);
		assertFalse(selector.selectPlan(8 * GB, roomy(), true, null).isStaged());
		assertFalse(selector.selectPlan(200 * MB, shortHeap, true, null).isStaged());
		assertFalse(selector.selectPlan(100 * MB, new MemorySnapshot(6 * GB, 4 * GB, 0, 4 * GB), true, null).isStaged());

		assertTrue(selector.selectPlan(11 * GB, roomy(), true, null).isStaged());
		assertTrue(selector.selectPlan(100 * MB, new MemorySnapshot(16 * GB, 512 * MB, 0, 4 * GB), true, null).isStaged());
		assertTrue(selector.selectPlan(100 * MB, new MemorySnapshot(3 * GB, 2 * GB, 0, 4 * GB), true, null).isStaged());
	}

	@Test
	public void testExplicitOverrideWins() {
		MemorySnapshot tight = new MemorySnapshot(4 * GB, 100 * MB, 900 * MB, 1 * GB);

		assertEquals(LoadPlan.Strategy.EAGER, selector.selectPlan(3 * GB, tight, false, Boolean.FALSE).strategy());
		assertEquals(LoadPlan.Strategy.STAGED, selector.selectPlan(1 * MB, roomy(), true, Boolean.TRUE).strategy());
	}

	@Test
	public void testStagingIsMonotoneInAvailableMemory() {
		long model = 2 * GB;
		boolean staged = false;
		boolean stagedWithPerformance = false;
		for (long available = 16 * GB; available >= 0; available -= 256 * MB) {
			MemorySnapshot snapshot = new MemorySnapshot(16 * GB, available, 100 * MB, 8 * GB);
			boolean now = selector.shouldStage(model, snapshot, false);
			boolean nowWithPerformance = selector.shouldStage(model, snapshot, true);
			assertTrue("staging flipped back to eager at " + available / MB + "MB", now || !staged);
			assertTrue(nowWithPerformance || !stagedWithPerformance);
			// the relaxed thresholds never stage where the default ones do not
			assertTrue(now || !nowWithPerformance);
			staged = now;
			stagedWithPerformance = nowWithPerformance;
		}
		assertTrue(staged);
		assertTrue(stagedWithPerformance);
	}

	@Test
	public void testStagingIsMonotoneInHeapHeadroom() {
		long model = 300 * MB;
		boolean staged = false;
		for (long used = 0; used <= 2 * GB; used += 64 * MB) {
			MemorySnapshot snapshot = new MemorySnapshot(16 * GB, 12 * GB, used, 2 * GB);
			boolean now = selector.shouldStage(model, snapshot, false);
			assertTrue(now || !staged);
			staged = now;
		}
		assertTrue(staged);
	}

	@Test
	public void testThreadsCappedUnlessPreferPerformance() {
		LoadOptions conservative = LoadOptions.builder().build();
		LoadOptions performance = LoadOptions.builder().preferPerformance(true).build();

		assertEquals(2, selector.selectPlan(ModelFamily.IMAGE_DIFFUSION, GB, roomy(), conservative).threadCount());
		assertEquals(8, selector.selectPlan(ModelFamily.IMAGE_DIFFUSION, GB, roomy(), performance).threadCount());
		assertEquals(1, selector.selectPlan(ModelFamily.IMAGE_DIFFUSION, GB, roomy(),
			LoadOptions.builder().threadCount(1).build()).threadCount());
	}

	@Test
	public void testGpuRules() {
		LoadOptions none = LoadOptions.builder().targetSize(512, 512).build();
		LoadOptions forced = LoadOptions.builder().forceGpu(true).targetSize(512, 512).build();
		LoadOptions forcedSmall = LoadOptions.builder().forceGpu(true).targetSize(128, 128).build();
		LoadOptions performanceSmall = LoadOptions.builder().preferPerformance(true).targetSize(192, 256).build();

		assertFalse(selector.selectPlan(ModelFamily.IMAGE_DIFFUSION, GB, roomy(), none).gpuOffload());
		assertTrue(selector.selectPlan(ModelFamily.IMAGE_DIFFUSION, GB, roomy(), forced).gpuOffload());
		assertFalse(selector.selectPlan(ModelFamily.IMAGE_DIFFUSION, GB, roomy(), forcedSmall).gpuOffload());
		assertFalse(selector.selectPlan(ModelFamily.IMAGE_DIFFUSION, GB, roomy(), performanceSmall).gpuOffload());
	}

	@Test
	public void testStagedPlanCarriesSequentialFlags() {
		LoadPlan plan = selector.selectPlan(8 * GB, roomy(), false, null);
		Set<BackendFlag> flags = plan.backendFlags();

		assertTrue(flags.contains(BackendFlag.SEQUENTIAL_LOAD));
		assertTrue(flags.contains(BackendFlag.OFFLOAD_TO_CPU));
		assertTrue(flags.contains(BackendFlag.KEEP_CLIP_ON_CPU));
		assertTrue(flags.contains(BackendFlag.KEEP_VAE_ON_CPU));
		assertFalse(flags.contains(BackendFlag.MLOCK));
		assertTrue(BackendFlag.SEQUENTIAL_LOAD.isSet(plan.backendFlagMask()));
		assertFalse(BackendFlag.GPU_OFFLOAD.isSet(plan.backendFlagMask()));
	}

	@Test
	public void testTextContextSizeFollowsHeap() {
		assertEquals(2048, LoadStrategySelector.contextSizeForHeap(256 * MB, 0));
		assertEquals(4096, LoadStrategySelector.contextSizeForHeap(384 * MB, 0));
		assertEquals(6144, LoadStrategySelector.contextSizeForHeap(512 * MB, 8192));
		assertEquals(8192, LoadStrategySelector.contextSizeForHeap(2 * GB, 0));
		assertEquals(1024, LoadStrategySelector.contextSizeForHeap(2 * GB, 1024));

		LoadOptions options = LoadOptions.builder().contextSize(4096).build();
		MemorySnapshot smallHeap = new MemorySnapshot(16 * GB, 12 * GB, 10 * MB, 256 * MB);
		assertEquals(2048, selector.selectPlan(ModelFamily.TEXT, 10 * MB, smallHeap, options).contextSize());
		assertEquals(0, selector.selectPlan(ModelFamily.IMAGE_DIFFUSION, 10 * MB, smallHeap, options).contextSize());
	}

	@Test
	public void testFailureYieldsConservativePlan() {
		LoadStrategySelector broken = new LoadStrategySelector(null);

		LoadPlan plan = broken.selectPlan(ModelFamily.TEXT, GB, roomy(), LoadOptions.DEFAULT);

		assertTrue(plan.isStaged());
		assertEquals(1, plan.threadCount());
		assertFalse(plan.gpuOffload());
		assertTrue(plan.reason().startsWith("plan selection failed"));
	}
}
