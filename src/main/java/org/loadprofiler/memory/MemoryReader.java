package org.loadprofiler.memory;

import org.loadprofiler.exception.SamplerException;

/** Source of resource snapshots. */
public interface MemoryReader {

  ResourceSnapshot read() throws SamplerException;

  /** Heap bytes in use right now. */
  long heapUsed() throws SamplerException;
}
