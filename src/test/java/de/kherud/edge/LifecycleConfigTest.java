package de.kherud.edge;

import de.kherud.edge.cache.FamilyBudget;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LifecycleConfigTest {

	private static final long MB = 1024L * 1024L;

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	@Test
	public void testBuilderDefaults() {
		LifecycleConfig config = LifecycleConfig.defaults();

		assertFalse(config.isPreferPerformance());
		assertTrue(config.isCrossFamilyEviction());
		assertFalse(config.isRetainInactiveModels());
		assertEquals(0, config.getMemoryFloorBytes());
		assertEquals(100, config.getReleasePauseMillis());
		assertEquals(2, config.getWorkerThreads());
		assertEquals(FamilyBudget.DEFAULT, config.getBudget(ModelFamily.TRANSCRIPTION));
	}

	@Test
	public void testBundledDefaults() {
		LifecycleConfig config = LifecycleConfig.loadDefault();

		assertEquals(1, config.getBudget(ModelFamily.IMAGE_DIFFUSION).maxEntries());
		assertEquals(6144 * MB, config.getBudget(ModelFamily.VIDEO_DIFFUSION).maxBytes());
		assertEquals(2, config.getBudget(ModelFamily.TEXT).maxEntries());
		assertTrue(config.isCrossFamilyEviction());
	}

	@Test
	public void testFromJson() throws IOException {
		String json = "{\"preferPerformance\": true, \"memoryFloorMb\": 512, \"workerThreads\": 3,"
			+ " \"budgets\": {\"image_diffusion\": {\"maxEntries\": 1, \"maxMemoryMb\": 2048},"
			+ " \"embedding\": {\"maxEntries\": 4}}}";

		LifecycleConfig config = LifecycleConfig.fromJson(json);

		assertTrue(config.isPreferPerformance());
		assertEquals(512 * MB, config.getMemoryFloorBytes());
		assertEquals(3, config.getWorkerThreads());
		assertEquals(new FamilyBudget(1, 2048 * MB), config.getBudget(ModelFamily.IMAGE_DIFFUSION));
		assertEquals(4, config.getBudget(ModelFamily.EMBEDDING).maxEntries());
		assertEquals(FamilyBudget.DEFAULT.maxBytes(), config.getBudget(ModelFamily.EMBEDDING).maxBytes());
	}

	@Test
	public void testLoadFromFile() throws IOException {
		File file = tempFolder.newFile("edge.json");
		Files.write(file.toPath(), "{\"crossFamilyEviction\": false, \"releasePauseMillis\": 0}".getBytes(StandardCharsets.UTF_8));

		LifecycleConfig config = LifecycleConfig.load(file.toPath());

		assertFalse(config.isCrossFamilyEviction());
		assertEquals(0, config.getReleasePauseMillis());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownFamily() throws IOException {
		LifecycleConfig.fromJson("{\"budgets\": {\"audio\": {\"maxEntries\": 1}}}");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonObjectRoot() throws IOException {
		LifecycleConfig.fromJson("[1, 2]");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testZeroWorkerThreads() throws IOException {
		LifecycleConfig.fromJson("{\"workerThreads\": 0}");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeFloor() {
		LifecycleConfig.builder().memoryFloorMb(-1);
	}
}
