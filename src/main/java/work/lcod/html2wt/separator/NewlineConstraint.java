package work.lcod.html2wt.separator;

/**
 * Legal number of newlines between two emitted chunks. A missing bound means "no opinion".
 *
 * @param min lower bound, or {@code null}
 * @param max upper bound, or {@code null} (unbounded once normalized with {@link #UNBOUNDED})
 */
public record NewlineConstraint(Integer min, Integer max) {
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final NewlineConstraint NONE = new NewlineConstraint(null, null);

    public NewlineConstraint {
        if (min != null && min < 0) {
            throw new IllegalArgumentException("min must be non-negative: " + min);
        }
        if (max != null && max < 0) {
            throw new IllegalArgumentException("max must be non-negative: " + max);
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min " + min + " exceeds max " + max);
        }
    }

    public static NewlineConstraint of(int min, int max) {
        return new NewlineConstraint(min, max);
    }

    public static NewlineConstraint atLeast(int min) {
        return new NewlineConstraint(min, null);
    }

    public static NewlineConstraint atMost(int max) {
        return new NewlineConstraint(null, max);
    }

    public boolean isNone() {
        return min == null && max == null;
    }

    /**
     * Intersects two ranges. Absent bounds defer to the other side; when the intersection is empty the
     * minimum wins and the maximum is raised to it.
     */
    public static NewlineConstraint combine(NewlineConstraint a, NewlineConstraint b) {
        if (a == null || a.isNone()) {
            return b == null ? NONE : b;
        }
        if (b == null || b.isNone()) {
            return a;
        }
        Integer min = a.min == null ? b.min : b.min == null ? a.min : Integer.valueOf(Math.max(a.min, b.min));
        Integer max = a.max == null ? b.max : b.max == null ? a.max : Integer.valueOf(Math.min(a.max, b.max));
        if (min != null && max != null && max < min) {
            max = min;
        }
        return new NewlineConstraint(min, max);
    }

    /**
     * Fills absent bounds: {@code min} defaults to 0 and {@code max} to {@code ceiling}, never below
     * {@code min}.
     */
    public static NewlineConstraint normalize(NewlineConstraint constraint, int ceiling) {
        int min = constraint == null || constraint.min == null ? 0 : constraint.min;
        int max = constraint == null || constraint.max == null ? ceiling : constraint.max;
        return new NewlineConstraint(min, Math.max(min, max));
    }

    public boolean allows(int newlines) {
        return (min == null || newlines >= min) && (max == null || newlines <= max);
    }
}
