package work.lcod.empaths.api;

/**
 * Value produced by a scan step together with the index where scanning resumes.
 */
public record Resolution(Object value, int nextIndex) {}
