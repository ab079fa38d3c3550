package de.kherud.edge.plan;

import de.kherud.edge.ModelFamily;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

/**
 * Performance/efficiency core split of the host CPU, used to size native thread pools.
 * <p>
 * Detection reads {@code cpufreq/cpuinfo_max_freq} of every {@code cpuN} directory. When the slowest and fastest
 * cores differ by more than 30% the CPU is treated as big.LITTLE and every core reaching 85% of the top frequency
 * counts as a performance core. Without sysfs all cores count as performance cores.
 */
public final class CpuTopology {

	private static final System.Logger logger = System.getLogger(CpuTopology.class.getName());
	private static final Path CPU_SYSFS = Paths.get("/sys/devices/system/cpu");
	private static final double BIG_LITTLE_SPREAD = 0.30;
	private static final double PERFORMANCE_THRESHOLD = 0.85;

	private static volatile CpuTopology detected;

	private final int totalCores;
	private final int performanceCores;
	private final List<Long> maxFrequencies;

	private CpuTopology(int totalCores, int performanceCores, List<Long> maxFrequencies) {
		this.totalCores = totalCores;
		this.performanceCores = performanceCores;
		this.maxFrequencies = Collections.unmodifiableList(maxFrequencies);
	}

	public static CpuTopology of(int totalCores, int performanceCores) {
		if (totalCores < 1) {
			throw new IllegalArgumentException("Core count must be positive: " + totalCores);
		}
		if (performanceCores < 0 || performanceCores > totalCores) {
			throw new IllegalArgumentException("Performance cores must be in [0, " + totalCores + "]: " + performanceCores);
		}
		return new CpuTopology(totalCores, performanceCores, List.of());
	}

	/**
	 * Topology of the running host, detected once and cached.
	 */
	public static CpuTopology detect() {
		CpuTopology topology = detected;
		if (topology == null) {
			synchronized (CpuTopology.class) {
				topology = detected;
				if (topology == null) {
					topology = detect(CPU_SYSFS);
					logger.log(INFO, "Detected CPU topology: " + topology);
					detected = topology;
				}
			}
		}
		return topology;
	}

	static CpuTopology detect(Path cpuRoot) {
		List<Long> frequencies = readMaxFrequencies(cpuRoot);
		if (frequencies == null || frequencies.isEmpty()) {
			return fallback();
		}
		long max = 0;
		long min = Long.MAX_VALUE;
		for (long freq : frequencies) {
			if (freq <= 0) continue;
			max = Math.max(max, freq);
			min = Math.min(min, freq);
		}
		if (max == 0) {
			return fallback();
		}
		int performance;
		if (max - min > max * BIG_LITTLE_SPREAD) {
			double threshold = max * PERFORMANCE_THRESHOLD;
			performance = (int) frequencies.stream().filter(f -> f >= threshold).count();
		}
		else {
			performance = frequencies.size();
		}
		return new CpuTopology(frequencies.size(), performance, frequencies);
	}

	@Nullable
	private static List<Long> readMaxFrequencies(Path cpuRoot) {
		if (!Files.isDirectory(cpuRoot)) {
			logger.log(DEBUG, "CPU sysfs not available at " + cpuRoot);
			return null;
		}
		List<Path> cpuDirs = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(cpuRoot, "cpu[0-9]*")) {
			for (Path dir : stream) {
				if (Files.isDirectory(dir) && dir.getFileName().toString().matches("cpu\\d+")) {
					cpuDirs.add(dir);
				}
			}
		}
		catch (IOException e) {
			logger.log(DEBUG, "Failed to list " + cpuRoot, e);
			return null;
		}
		cpuDirs.sort((a, b) -> Integer.compare(cpuIndex(a), cpuIndex(b)));

		List<Long> frequencies = new ArrayList<>(cpuDirs.size());
		for (Path dir : cpuDirs) {
			Path freqFile = dir.resolve("cpufreq").resolve("cpuinfo_max_freq");
			long freq = 0;
			if (Files.isReadable(freqFile)) {
				try {
					freq = Long.parseLong(new String(Files.readAllBytes(freqFile), StandardCharsets.US_ASCII).trim());
				}
				catch (IOException | NumberFormatException e) {
					logger.log(DEBUG, "Failed to read max frequency of " + dir.getFileName(), e);
				}
			}
			frequencies.add(freq);
		}
		return frequencies;
	}

	private static int cpuIndex(Path dir) {
		return Integer.parseInt(dir.getFileName().toString().substring(3));
	}

	private static CpuTopology fallback() {
		int cores = Runtime.getRuntime().availableProcessors();
		return new CpuTopology(cores, cores, List.of());
	}

	public int getTotalCores() {
		return totalCores;
	}

	public int getPerformanceCores() {
		return performanceCores;
	}

	public int getEfficiencyCores() {
		return totalCores - performanceCores;
	}

	public boolean isBigLittle() {
		return getEfficiencyCores() > 0;
	}

	public List<Long> getMaxFrequencies() {
		return maxFrequencies;
	}

	/**
	 * Thread count that keeps a model of the given family busy without oversubscribing efficiency cores.
	 * {@code null} selects a family-neutral default.
	 */
	public int optimalThreads(@Nullable ModelFamily family) {
		if (family == null) {
			return Math.max(1, Math.min(4, performanceCores));
		}
		switch (family) {
			case TEXT:
				// token generation is sequential, half the P-cores avoids contention
				return performanceCores >= 4 ? Math.max(2, performanceCores / 2) : Math.max(1, Math.min(4, totalCores));
			case IMAGE_DIFFUSION:
			case VIDEO_DIFFUSION:
				return Math.max(2, totalCores);
			case EMBEDDING:
			case TRANSCRIPTION:
			default:
				return Math.min(2, totalCores);
		}
	}

	@Override
	public String toString() {
		return "CpuTopology{" + totalCores + " cores, " + performanceCores + " performance, "
			+ getEfficiencyCores() + " efficiency}";
	}
}
