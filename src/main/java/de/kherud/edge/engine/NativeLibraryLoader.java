package de.kherud.edge.engine;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Loads the JNI library backing {@link JniNativeEngine} once per class loader.
 * <p>
 * The library is looked up on {@code java.library.path} under the name {@value #LIBRARY_NAME}. Setting the system
 * property {@value #LIBRARY_PATH_PROPERTY} to an absolute file path loads that file instead.
 */
public final class NativeLibraryLoader {

	private static final System.Logger logger = System.getLogger(NativeLibraryLoader.class.getName());

	public static final String LIBRARY_NAME = "llamaedge";
	public static final String LIBRARY_PATH_PROPERTY = "de.kherud.edge.lib.path";

	private static boolean loaded;

	private NativeLibraryLoader() {
	}

	/**
	 * @throws UnsatisfiedLinkError if the library cannot be found or linked
	 */
	public static synchronized void initialize() {
		if (loaded) {
			return;
		}
		String explicitPath = System.getProperty(LIBRARY_PATH_PROPERTY);
		if (explicitPath != null && !explicitPath.isBlank()) {
			logger.log(DEBUG, "Loading native library from " + explicitPath);
			System.load(explicitPath);
		}
		else {
			logger.log(DEBUG, "Loading native library " + LIBRARY_NAME + " from java.library.path");
			System.loadLibrary(LIBRARY_NAME);
		}
		loaded = true;
	}

	public static synchronized boolean isLoaded() {
		return loaded;
	}
}
