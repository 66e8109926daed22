package work.lcod.form.serialize;

/**
 * Serializer settings. With {@code preserveOriginalFormatting} unchanged fields keep the text they
 * were parsed from; without it the whole document is regenerated.
 */
public record SerializeOptions(boolean preserveOriginalFormatting) {
    public static final SerializeOptions PRESERVE = new SerializeOptions(true);
    public static final SerializeOptions CANONICAL = new SerializeOptions(false);

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean preserveOriginalFormatting = true;

        public Builder preserveOriginalFormatting(boolean preserveOriginalFormatting) {
            this.preserveOriginalFormatting = preserveOriginalFormatting;
            return this;
        }

        public SerializeOptions build() {
            return new SerializeOptions(preserveOriginalFormatting);
        }
    }
}
