package org.astroimage.fits;

import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsUtil;
import nom.tam.util.BufferedFile;
import org.astroimage.fits.FitsReadException.Reason;

/**
 * Reads the primary image of a FITS file into a {@link Raster}.
 * <p>
 * The header is read card by card (80 bytes each) up to the END card, and is
 * deliberately lenient: a value that cannot be parsed is treated as absent.
 * Only single 2D (or 1D) uncompressed primary arrays are supported, in any
 * of the five standard BITPIX encodings. Every sample is rescaled as
 * {@code BSCALE * raw + BZERO}.
 */
public class FitsReader {

    private static final Logger LOG = Logger.getLogger(FitsReader.class.getName());

    static final int CARD_LENGTH = 80;
    static final int KEYWORD_LENGTH = 8;
    private static final int MAX_PIXELS = Integer.MAX_VALUE - 8;
    /**
     * Keywords which may carry the color filter layout, in order of
     * preference.
     */
    private static final String[] BAYER_KEYWORDS = {"BAYERPAT", "CFA-PAT", "COLORTYP"};

    /**
     * Decode a single file.
     *
     * @param path The file to read
     * @return The decoded raster
     * @throws FitsReadException If the file is missing or cannot be decoded
     * @throws IOException If an I/O error occurs while reading
     */
    public Raster decode(String path) throws IOException {
        if (path == null || path.trim().isEmpty()) {
            throw new IllegalArgumentException("File path cannot be null or empty");
        }
        File file = new File(path);
        if (!file.isFile() || !file.canRead()) {
            throw new FitsReadException(Reason.NOT_FOUND, path, "FITS file not found");
        }
        return Timed.execute(() -> readPrimaryImage(file, path), "Decoding %s took %dms", path);
    }

    /**
     * Decode a sequence of files lazily, one file per call to
     * {@link Iterator#next()}. A failure is thrown from {@code next()} as an
     * {@link java.io.UncheckedIOException} and ends the sequence.
     *
     * @param paths The files to read
     * @return An iterator over the decoded rasters
     */
    public BatchIterator<String, Raster> decodeAll(Iterable<String> paths) {
        return new BatchIterator<>(paths.iterator(), this::decode);
    }

    private Raster readPrimaryImage(File file, String path) throws IOException {
        try (BufferedFile in = new BufferedFile(file, "r")) {
            Map<String, String> header = new HashMap<>();
            int headerLength = readHeader(in, header, path);
            skipPadding(in, headerLength, path);

            int bitpix = intValue(header, "BITPIX");
            int naxis = intValue(header, "NAXIS");
            int width = intValue(header, "NAXIS1");
            int height = naxis >= 2 ? intValue(header, "NAXIS2") : 1;
            if (width <= 0 || height <= 0) {
                throw new FitsReadException(Reason.INVALID_DIMENSIONS, path, String.format("Invalid FITS dimensions %dx%d", width, height));
            }
            if ((long) width * height > MAX_PIXELS) {
                throw new FitsReadException(Reason.INVALID_DIMENSIONS, path, String.format("FITS dimensions %dx%d too large", width, height));
            }
            double bscale = doubleValue(header, "BSCALE", 1.0);
            double bzero = doubleValue(header, "BZERO", 0.0);

            PixelEncoding encoding = PixelEncoding.forBitpix(bitpix);
            if (encoding == null) {
                throw new FitsReadException(Reason.UNSUPPORTED_ENCODING, path, "Unsupported BITPIX value " + bitpix);
            }
            LOG.log(Level.FINE, "Reading {0}x{1} {2} image from {3}", new Object[]{width, height, encoding, path});
            double[] pixels = readPixels(in, encoding, width, height, bscale, bzero, path);

            header.put("NAXIS1", Integer.toString(width));
            header.put("NAXIS2", Integer.toString(height));
            header.put("BITPIX", Integer.toString(bitpix));
            return Raster.wrap(path, width, height, pixels, header, findBayerPattern(header));
        }
    }

    /**
     * Read header cards up to and including END.
     *
     * @return The number of header bytes consumed
     */
    private static int readHeader(BufferedFile in, Map<String, String> header, String path) throws IOException {
        byte[] card = new byte[CARD_LENGTH];
        int length = 0;
        for (;;) {
            if (!fill(in, card)) {
                throw new FitsReadException(Reason.MALFORMED_HEADER, path, "Unexpected end of file while reading FITS header");
            }
            length += CARD_LENGTH;
            String text = new String(card, StandardCharsets.US_ASCII);
            String keyword = text.substring(0, KEYWORD_LENGTH).trim();
            // Only an upper case END terminates, other keywords are case-insensitive
            if ("END".equals(keyword)) {
                return length;
            }
            if (!keyword.isEmpty()) {
                header.put(keyword.toUpperCase(Locale.ROOT), cardValue(text));
            }
        }
    }

    /**
     * The value of a {@code KEYWORD = value / comment} card, or the empty
     * string for commentary cards. The value ends at the first '/'.
     */
    static String cardValue(String card) {
        if (card.length() <= KEYWORD_LENGTH + 1 || card.charAt(KEYWORD_LENGTH) != '=' || card.charAt(KEYWORD_LENGTH + 1) != ' ') {
            return "";
        }
        String valueAndComment = card.substring(KEYWORD_LENGTH + 2);
        int slash = valueAndComment.indexOf('/');
        return (slash >= 0 ? valueAndComment.substring(0, slash) : valueAndComment).trim();
    }

    private static void skipPadding(BufferedFile in, int headerLength, String path) throws IOException {
        try {
            in.skip(FitsUtil.padding(headerLength));
        } catch (EOFException x) {
            throw new FitsReadException(Reason.TRUNCATED_DATA, path, "Unexpected end of file after FITS header");
        }
    }

    private static double[] readPixels(BufferedFile in, PixelEncoding encoding, int width, int height, double bscale, double bzero, String path) throws IOException {
        long rowLength = (long) width * encoding.getBytesPerSample();
        if (rowLength > MAX_PIXELS) {
            throw new FitsReadException(Reason.INVALID_DIMENSIONS, path, "FITS row length too large");
        }
        double[] pixels = new double[width * height];
        byte[] row = new byte[(int) rowLength];
        ByteBuffer bb = ByteBuffer.wrap(row);
        bb.order(ByteOrder.BIG_ENDIAN);
        int p = 0;
        for (int y = 0; y < height; y++) {
            if (!fill(in, row)) {
                throw new FitsReadException(Reason.TRUNCATED_DATA, path, String.format("Unexpected end of file in row %d of %s image data", y, encoding));
            }
            bb.clear();
            for (int x = 0; x < width; x++) {
                pixels[p++] = bscale * encoding.read(bb) + bzero;
            }
        }
        return pixels;
    }

    /**
     * Read exactly {@code buffer.length} bytes.
     *
     * @return false if the file ended first
     */
    private static boolean fill(BufferedFile in, byte[] buffer) throws IOException {
        int offset = 0;
        try {
            while (offset < buffer.length) {
                int n = in.read(buffer, offset, buffer.length - offset);
                if (n <= 0) {
                    return false;
                }
                offset += n;
            }
        } catch (EOFException x) {
            return false;
        }
        return true;
    }

    private static BayerPattern findBayerPattern(Map<String, String> header) {
        for (String keyword : BAYER_KEYWORDS) {
            BayerPattern pattern = BayerPattern.parse(header.get(keyword));
            if (pattern != null) {
                return pattern;
            }
        }
        return null;
    }

    /**
     * Parse an integer header value, 0 if absent or unparseable. Values
     * such as {@code 16.0} or {@code 1.6E1} are accepted when integral.
     */
    static int intValue(Map<String, String> header, String keyword) {
        String value = header.get(keyword);
        if (value == null) {
            return 0;
        }
        String text = BayerPattern.stripQuotes(value);
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException x) {
            try {
                return new BigDecimal(fortranExponent(text)).intValueExact();
            } catch (NumberFormatException | ArithmeticException xx) {
                LOG.log(Level.FINE, "Ignoring unparseable {0} value {1}", new Object[]{keyword, value});
                return 0;
            }
        }
    }

    /**
     * Parse a floating point header value, falling back to the default if
     * absent or unparseable.
     */
    static double doubleValue(Map<String, String> header, String keyword, double defaultValue) {
        String value = header.get(keyword);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(fortranExponent(BayerPattern.stripQuotes(value)));
        } catch (NumberFormatException x) {
            LOG.log(Level.FINE, "Ignoring unparseable {0} value {1}", new Object[]{keyword, value});
            return defaultValue;
        }
    }

    // FITS allows a Fortran style D exponent, e.g. 1.0D+02
    private static String fortranExponent(String text) {
        return text.replace('D', 'E').replace('d', 'e');
    }
}
