package com.kiln.pipeline.contract;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed {@code spec.when.condition}. Parsing happens when the pipeline is resolved, so a malformed condition
 * fails the run before any link executes.
 */
public final class WhenCondition {

    public enum Kind {
        ALWAYS("always"),
        ON_SUCCESS("on_success"),
        ON_FAILURE("on_failure"),
        IF_ARTIFACT_EXISTS("if_artifact_exists");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    public static final WhenCondition ALWAYS = new WhenCondition(Kind.ALWAYS, null);

    private static final Pattern CALL = Pattern.compile("^(on_success|on_failure|if_artifact_exists)\\(\\s*([^()\\s]+)\\s*\\)$");

    private final Kind kind;
    private final String target;

    private WhenCondition(Kind kind, String target) {
        this.kind = kind;
        this.target = target;
    }

    public static WhenCondition onSuccess(String linkId) {
        return new WhenCondition(Kind.ON_SUCCESS, Objects.requireNonNull(linkId));
    }

    public static WhenCondition onFailure(String linkId) {
        return new WhenCondition(Kind.ON_FAILURE, Objects.requireNonNull(linkId));
    }

    public static WhenCondition ifArtifactExists(String artifactId) {
        return new WhenCondition(Kind.IF_ARTIFACT_EXISTS, Objects.requireNonNull(artifactId));
    }

    /**
     * Parses {@code always}, {@code on_success(link)}, {@code on_failure(link)} or
     * {@code if_artifact_exists(artifact)}. Null or blank means {@code always}.
     *
     * @throws InvalidContractException for anything else
     */
    public static WhenCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return ALWAYS;
        }
        String trimmed = expression.trim();
        if (Kind.ALWAYS.keyword.equals(trimmed)) {
            return ALWAYS;
        }
        Matcher m = CALL.matcher(trimmed);
        if (!m.matches()) {
            throw new InvalidContractException("Malformed when condition: '" + expression
                    + "' (expected always, on_success(<link>), on_failure(<link>) or if_artifact_exists(<artifact>))");
        }
        String target = m.group(2);
        switch (m.group(1)) {
            case "on_success":
                return onSuccess(target);
            case "on_failure":
                return onFailure(target);
            default:
                return ifArtifactExists(target);
        }
    }

    public Kind getKind() {
        return kind;
    }

    /** Link id or artifact id the condition refers to; null for {@code always}. */
    public String getTarget() {
        return target;
    }

    public boolean evaluate(Predicate<String> linkSucceeded, Predicate<String> linkFailed, Predicate<String> artifactExists) {
        switch (kind) {
            case ON_SUCCESS:
                return linkSucceeded.test(target);
            case ON_FAILURE:
                return linkFailed.test(target);
            case IF_ARTIFACT_EXISTS:
                return artifactExists.test(target);
            case ALWAYS:
            default:
                return true;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WhenCondition)) return false;
        WhenCondition that = (WhenCondition) o;
        return kind == that.kind && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, target);
    }

    /** Canonical expression form, as recorded in ledger metrics. */
    @Override
    public String toString() {
        return kind == Kind.ALWAYS ? kind.keyword : kind.keyword + "(" + target + ")";
    }
}
