package salesman.utils;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.apache.log4j.Logger;

import salesman.heuristics.ProgressSink;

/**
 * Append-only CSV of (algorithm, step, best length) records. Several
 * heuristics may write to the same log concurrently through their own
 * {@link #sinkFor(String) sink}.
 */
public class CsvProgressLog implements Closeable {

	private static Logger log = Logger.getLogger(CsvProgressLog.class);

	public static final String HEADER = "algorithm,step,best_length";

	private final File file;
	private final BufferedWriter writer;
	private long records = 0;

	public CsvProgressLog(File file) {
		this.file = file;
		try {
			File dir = file.getAbsoluteFile().getParentFile();
			if (dir != null && !dir.isDirectory() && !dir.mkdirs())
				throw new IOException("Cannot create directory " + dir);
			this.writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file, false), StandardCharsets.UTF_8));
			writer.write(HEADER + "\n");
			writer.flush();
		} catch (IOException e) {
			log.error("Cannot open progress log " + file, e);
			throw new UncheckedIOException(e);
		}
		log.info("Logging progress to " + file.getAbsolutePath());
	}

	// first <prefix><n>.csv in dir that does not exist yet
	public static File nextFreeFile(File dir, String prefix) {
		int n = 0;
		File f;
		while ((f = new File(dir, prefix + n + ".csv")).exists())
			n++;
		return f;
	}

	public synchronized void append(String algorithm, long step, double bestLength) {
		try {
			writer.write(algorithm + "," + step + "," + bestLength + "\n");
			writer.flush();
			records++;
		} catch (IOException e) {
			log.error("Cannot write to progress log " + file, e);
			throw new UncheckedIOException(e);
		}
	}

	public ProgressSink sinkFor(String algorithm) {
		return (step, bestLength) -> append(algorithm, step, bestLength);
	}

	public synchronized long getRecords() {
		return records;
	}

	@Override
	public synchronized void close() throws IOException {
		writer.close();
	}
}
