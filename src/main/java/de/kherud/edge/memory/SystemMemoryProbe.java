package de.kherud.edge.memory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;

/**
 * {@link MemoryProbe} backed by the JVM management beans.
 * <p>
 * Device figures come from {@code com.sun.management.OperatingSystemMXBean} when the runtime provides it. On
 * runtimes without it the heap limit stands in for device memory, which errs on the side of staged loading.
 */
public class SystemMemoryProbe implements MemoryProbe {

	private final MemoryMXBean memoryBean;
	private final OperatingSystemMXBean osBean;

	public SystemMemoryProbe() {
		this.memoryBean = ManagementFactory.getMemoryMXBean();
		this.osBean = ManagementFactory.getOperatingSystemMXBean();
	}

	@Override
	public MemorySnapshot snapshot() {
		MemoryUsage heapUsage = memoryBean.getHeapMemoryUsage();
		long heapUsed = heapUsage.getUsed();
		long heapMax = heapUsage.getMax() > 0 ? heapUsage.getMax() : Runtime.getRuntime().maxMemory();

		long total = -1;
		long available = -1;
		if (osBean instanceof com.sun.management.OperatingSystemMXBean) {
			com.sun.management.OperatingSystemMXBean sunBean = (com.sun.management.OperatingSystemMXBean) osBean;
			total = sunBean.getTotalMemorySize();
			available = sunBean.getFreeMemorySize();
		}
		if (total <= 0) {
			total = heapMax;
			available = Math.max(0L, heapMax - heapUsed);
		}
		return new MemorySnapshot(total, Math.max(0L, available), heapUsed, heapMax);
	}
}
