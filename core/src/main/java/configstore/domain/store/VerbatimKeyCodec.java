package configstore.domain.store;

final class VerbatimKeyCodec implements KeyCodec {
    static final VerbatimKeyCodec INSTANCE = new VerbatimKeyCodec();

    private VerbatimKeyCodec() {
    }

    @Override
    public String encode(final String key) {
        return key;
    }

    @Override
    public String decode(final String encoded) {
        return encoded;
    }
}
