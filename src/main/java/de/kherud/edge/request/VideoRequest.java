package de.kherud.edge.request;

import de.kherud.edge.validation.ParameterValidator;
import de.kherud.edge.validation.ValidationException;

/**
 * Text-to-video diffusion.
 * <p>
 * Video models decode frames in groups of four after a leading key frame, so the number of frames actually produced
 * is {@code (videoFrames - 1) / 4 * 4 + 1}.
 */
public final class VideoRequest extends DiffusionRequest<VideoResult> {

	public static final int MAX_VIDEO_FRAMES = 64;
	public static final int MIN_ACTUAL_FRAMES = 5;

	private final int videoFrames;
	private final int fps;

	private VideoRequest(Builder builder) {
		super(builder);
		this.videoFrames = builder.videoFrames;
		this.fps = builder.fps;
	}

	public static Builder builder(String prompt) {
		return new Builder(prompt);
	}

	@Override
	public Operation getOperation() {
		return Operation.TEXT_TO_VIDEO;
	}

	@Override
	public void validate() {
		super.validate();
		ParameterValidator.requireAtMost("videoFrames", videoFrames, MAX_VIDEO_FRAMES);
		if (getActualFrameCount() < MIN_ACTUAL_FRAMES) {
			throw new ValidationException("videoFrames",
				"must yield at least " + MIN_ACTUAL_FRAMES + " frames after 4n+1 alignment", videoFrames);
		}
		ParameterValidator.requireRange("fps", fps, 1, 60);
	}

	/**
	 * Number of frames the model will produce for the requested count.
	 */
	public int getActualFrameCount() {
		return actualFrameCount(videoFrames);
	}

	public static int actualFrameCount(int requestedFrames) {
		if (requestedFrames < 1) {
			return 0;
		}
		return (requestedFrames - 1) / 4 * 4 + 1;
	}

	@Override
	public String unitName() {
		return "frames";
	}

	@Override
	public long producedUnits(VideoResult result) {
		return result.frameCount();
	}

	public int getVideoFrames() {
		return videoFrames;
	}

	public int getFps() {
		return fps;
	}

	public static class Builder extends DiffusionRequest.Builder<Builder> {
		private int videoFrames = 17;
		private int fps = 16;

		public Builder(String prompt) {
			super(prompt, 512, 20);
		}

		public Builder videoFrames(int videoFrames) {
			this.videoFrames = videoFrames;
			return this;
		}

		public Builder fps(int fps) {
			this.fps = fps;
			return this;
		}

		public VideoRequest build() {
			return new VideoRequest(this);
		}
	}
}
