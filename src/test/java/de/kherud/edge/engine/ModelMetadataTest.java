package de.kherud.edge.engine;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.request.Operation;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ModelMetadataTest {

	@Test
	public void testParameterCountFromFileName() {
		assertEquals("1.3B", ModelMetadata.detectParameterCount("wan2.1_t2v_1.3B_fp16.gguf"));
		assertEquals("5B", ModelMetadata.detectParameterCount("Wan2.2-TI2V-5B-Q4_K_M.gguf"));
		assertEquals("14B", ModelMetadata.detectParameterCount("wan2.1-t2v-14b-q8.gguf"));
		assertNull(ModelMetadata.detectParameterCount("sd-v1-5-pruned.gguf"));
	}

	@Test
	public void testParameterCountRequiresWholeToken() {
		assertNull(ModelMetadata.detectParameterCount("qwen2.5-1.5b-instruct-q4.gguf"));
		assertNull(ModelMetadata.detectParameterCount("video-2.5b-q4.gguf"));
		assertNull(ModelMetadata.detectParameterCount("video-15b-q4.gguf"));
		assertNull(ModelMetadata.detectParameterCount("video-114b.gguf"));
		assertEquals("5B", ModelMetadata.detectParameterCount("wan_5_b.gguf"));
		assertEquals("14B", ModelMetadata.detectParameterCount("14b-video.gguf"));
		assertEquals(64, ModelMetadata.detect(ModelFamily.VIDEO_DIFFUSION, "video-1.5b-q4.gguf", 0).getMaxVideoFrames(64));
		assertTrue(ModelMetadata.detect(ModelFamily.VIDEO_DIFFUSION, "video-114b.gguf", 0).isMobileSupported());
	}

	@Test
	public void testLargeVideoModelsAreNotMobileSupported() {
		assertFalse(ModelMetadata.detect(ModelFamily.VIDEO_DIFFUSION, "wan-t2v-14b.gguf", 0).isMobileSupported());
		assertTrue(ModelMetadata.detect(ModelFamily.VIDEO_DIFFUSION, "wan-t2v-1.3b.gguf", 0).isMobileSupported());
		assertTrue(ModelMetadata.detect(ModelFamily.TEXT, "qwen-14b-instruct.gguf", 0).isMobileSupported());
	}

	@Test
	public void testFrameLimitDependsOnParameterClass() {
		assertEquals(32, ModelMetadata.detect(ModelFamily.VIDEO_DIFFUSION, "wan-ti2v-5b.gguf", 0).getMaxVideoFrames(64));
		assertEquals(64, ModelMetadata.detect(ModelFamily.VIDEO_DIFFUSION, "wan-t2v-1.3b.gguf", 0).getMaxVideoFrames(64));
	}

	@Test
	public void testSupportedOperationsFollowFamily() {
		ModelMetadata text = ModelMetadata.detect(ModelFamily.TEXT, "smollm.gguf", 0);
		assertTrue(text.supports(Operation.COMPLETION));
		assertTrue(text.supports(Operation.EMBEDDING));
		assertFalse(text.supports(Operation.TEXT_TO_VIDEO));
	}
}
