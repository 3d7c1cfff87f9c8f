package com.sparqlx.jena.convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Base64;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.datatype.DatatypeConfigurationException;
import javax.xml.datatype.DatatypeFactory;
import org.apache.jena.datatypes.DatatypeFormatException;
import org.apache.jena.datatypes.RDFDatatype;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.sys.JenaSystem;
import org.apache.jena.vocabulary.RDF;

/**
 * Maps one SPARQL JSON term descriptor to a {@link BindingValue}.
 *
 * <p>Typed literals are first validated against their XSD datatype using
 * Jena's datatype implementations, then converted to a native Java type:</p>
 * <ul>
 *   <li>string-like types and plain literals: {@link String}</li>
 *   <li>{@code xsd:boolean}: {@link Boolean}</li>
 *   <li>{@code xsd:integer} and derived types: {@link BigInteger}</li>
 *   <li>{@code xsd:decimal}: {@link BigDecimal}</li>
 *   <li>{@code xsd:double}/{@code xsd:float}: {@link Double}/{@link Float}</li>
 *   <li>{@code xsd:date}: {@link LocalDate}, or {@link OffsetDateTime}
 *       at the start of the day when a zone is given;
 *       {@code xsd:dateTime}: {@link OffsetDateTime} or
 *       {@link LocalDateTime}; {@code xsd:time}: {@link OffsetTime} or
 *       {@link LocalTime}. The end-of-day form {@code 24:00:00} becomes
 *       midnight of the following day.</li>
 *   <li>durations: {@link java.time.Duration}, {@link Period} or
 *       {@link javax.xml.datatype.Duration}</li>
 *   <li>binary types: a read-only {@link ByteBuffer}</li>
 * </ul>
 *
 * <p>The Gregorian fragment types ({@code xsd:gYear}, {@code xsd:gYearMonth},
 * {@code xsd:gMonth}, {@code xsd:gDay}, {@code xsd:gMonthDay}) are validated
 * but returned as {@link BindingValue.RawLiteral}. Any other datatype fails
 * with {@link UnsupportedLiteralTypeException}.</p>
 *
 * <p>This class is stateless and safe for concurrent use.</p>
 */
public final class LiteralCoercion {

    static {
        // XSDDatatype and the RDF vocabulary need Jena initialised first
        JenaSystem.init();
    }

    /** XSD date without zone; years may have more than four digits. */
    private static final DateTimeFormatter LOCAL_DATE =
        new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4, 10, SignStyle.NORMAL)
            .appendLiteral('-')
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendLiteral('-')
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .toFormatter();

    /** XSD time without zone, any number of fraction digits up to nine. */
    private static final DateTimeFormatter LOCAL_TIME =
        new DateTimeFormatterBuilder()
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    /** {@code xsd:date} with optional zone. */
    private static final DateTimeFormatter XSD_DATE = withOptionalZone(
        new DateTimeFormatterBuilder().append(LOCAL_DATE));

    /** {@code xsd:time} with optional zone. */
    private static final DateTimeFormatter XSD_TIME = withOptionalZone(
        new DateTimeFormatterBuilder().append(LOCAL_TIME));

    /** {@code xsd:dateTime} with optional zone. */
    private static final DateTimeFormatter XSD_DATE_TIME = withOptionalZone(
        new DateTimeFormatterBuilder()
            .append(LOCAL_DATE)
            .appendLiteral('T')
            .append(LOCAL_TIME));

    /** The end-of-day time of day. */
    private static final Pattern END_OF_DAY =
        Pattern.compile("24:00:00(?:\\.0+)?");

    /** Datatypes whose values are kept in lexical form, by IRI. */
    private static final Map<String, RDFDatatype> RAW_DATATYPES = Map.of(
        XSDDatatype.XSDgYear.getURI(), XSDDatatype.XSDgYear,
        XSDDatatype.XSDgYearMonth.getURI(), XSDDatatype.XSDgYearMonth,
        XSDDatatype.XSDgMonth.getURI(), XSDDatatype.XSDgMonth,
        XSDDatatype.XSDgDay.getURI(), XSDDatatype.XSDgDay,
        XSDDatatype.XSDgMonthDay.getURI(), XSDDatatype.XSDgMonthDay);

    /** Native converters keyed by datatype IRI. */
    private static final Map<String, Coercion> COERCIONS = new HashMap<>();

    static {
        Function<String, Object> asString = lexical -> lexical;
        register(XSDDatatype.XSDstring, asString);
        register(XSDDatatype.XSDnormalizedString, asString);
        register(XSDDatatype.XSDtoken, asString);
        register(XSDDatatype.XSDlanguage, asString);
        register(XSDDatatype.XSDName, asString);
        register(XSDDatatype.XSDNCName, asString);
        register(XSDDatatype.XSDNMTOKEN, asString);
        register(XSDDatatype.XSDanyURI, asString);
        COERCIONS.put(RDF.dtLangString.getURI(), new Coercion(null, asString));

        register(XSDDatatype.XSDboolean, LiteralCoercion::toBoolean);

        Function<String, Object> asInteger = lexical ->
            new BigInteger(lexical.strip());
        for (XSDDatatype integerType : new XSDDatatype[] {
            XSDDatatype.XSDinteger, XSDDatatype.XSDlong, XSDDatatype.XSDint,
            XSDDatatype.XSDshort, XSDDatatype.XSDbyte,
            XSDDatatype.XSDnonNegativeInteger,
            XSDDatatype.XSDnonPositiveInteger,
            XSDDatatype.XSDpositiveInteger, XSDDatatype.XSDnegativeInteger,
            XSDDatatype.XSDunsignedLong, XSDDatatype.XSDunsignedInt,
            XSDDatatype.XSDunsignedShort, XSDDatatype.XSDunsignedByte}) {
            register(integerType, asInteger);
        }
        register(XSDDatatype.XSDdecimal,
            lexical -> new BigDecimal(lexical.strip()));
        register(XSDDatatype.XSDdouble,
            lexical -> toDouble(lexical.strip()));
        register(XSDDatatype.XSDfloat,
            lexical -> toFloat(lexical.strip()));

        register(XSDDatatype.XSDdate,
            lexical -> toDate(lexical.strip()));
        register(XSDDatatype.XSDdateTime,
            lexical -> toDateTime(lexical.strip()));
        register(XSDDatatype.XSDdateTimeStamp,
            lexical -> toDateTime(lexical.strip()));
        register(XSDDatatype.XSDtime,
            lexical -> toTime(lexical.strip()));

        register(XSDDatatype.XSDdayTimeDuration,
            lexical -> java.time.Duration.parse(lexical.strip()));
        register(XSDDatatype.XSDyearMonthDuration,
            lexical -> Period.parse(lexical.strip()));
        register(XSDDatatype.XSDduration,
            lexical -> DurationFactoryHolder.FACTORY.newDuration(
                lexical.strip()));

        register(XSDDatatype.XSDhexBinary, lexical -> ByteBuffer.wrap(
            HexFormat.of().parseHex(lexical.strip())).asReadOnlyBuffer());
        register(XSDDatatype.XSDbase64Binary, lexical -> ByteBuffer.wrap(
            Base64.getMimeDecoder().decode(lexical.strip()))
            .asReadOnlyBuffer());
    }

    /** Prevent instantiation. */
    private LiteralCoercion() {
        throw new AssertionError("No instances");
    }

    /**
     * Converts a term descriptor to a binding value.
     *
     * @param term the descriptor, or null when the variable is absent
     *     from the row
     * @return the binding value; {@link BindingValue#UNBOUND} for null
     * @throws UnsupportedLiteralTypeException if a literal has a datatype
     *     without a native mapping
     * @throws MalformedLiteralException if a literal's lexical form is
     *     invalid for its datatype
     * @throws MalformedResultsPayloadException if the term type is unknown
     */
    public static BindingValue toBindingValue(final RdfTerm term) {
        if (term == null) {
            return BindingValue.UNBOUND;
        }
        return switch (term.type()) {
            case RdfTerm.TYPE_URI -> new BindingValue.Uri(term.value());
            case RdfTerm.TYPE_BNODE -> new BindingValue.BlankNode(term.value());
            case RdfTerm.TYPE_LITERAL, RdfTerm.TYPE_TYPED_LITERAL ->
                coerceLiteral(term.value(), term.datatype(), term.language());
            default -> throw new MalformedResultsPayloadException(
                "Unknown RDF term type '" + term.type() + "'");
        };
    }

    /**
     * Converts one literal to a binding value.
     *
     * @param lexicalForm the lexical form
     * @param datatype the datatype IRI, or null for a plain literal
     * @param language the language tag, or null
     * @return a {@link BindingValue.Literal} or, for Gregorian fragment
     *     types, a {@link BindingValue.RawLiteral}
     */
    public static BindingValue coerceLiteral(final String lexicalForm,
                                             final String datatype,
                                             final String language) {
        if (datatype == null) {
            return new BindingValue.Literal(lexicalForm, null, language);
        }
        RDFDatatype rawType = RAW_DATATYPES.get(datatype);
        if (rawType != null) {
            // parsed only to reject invalid lexical forms
            validate(rawType, datatype, lexicalForm);
            return new BindingValue.RawLiteral(lexicalForm, datatype);
        }
        Coercion coercion = COERCIONS.get(datatype);
        if (coercion == null) {
            throw new UnsupportedLiteralTypeException(datatype, lexicalForm);
        }
        if (coercion.validator() != null) {
            validate(coercion.validator(), datatype, lexicalForm);
        }
        try {
            return new BindingValue.Literal(
                coercion.toNative().apply(lexicalForm), datatype, language);
        } catch (DateTimeException | IllegalArgumentException e) {
            throw new MalformedLiteralException(datatype, lexicalForm, e);
        }
    }

    /**
     * Whether a datatype IRI has a native or raw mapping.
     *
     * @param datatype the datatype IRI
     * @return true if literals of this datatype can be converted
     */
    public static boolean isSupported(final String datatype) {
        return datatype == null || RAW_DATATYPES.containsKey(datatype)
            || COERCIONS.containsKey(datatype);
    }

    private static void register(final XSDDatatype datatype,
                                 final Function<String, Object> toNative) {
        COERCIONS.put(datatype.getURI(), new Coercion(datatype, toNative));
    }

    private static void validate(final RDFDatatype rdfDatatype,
                                 final String datatype,
                                 final String lexicalForm) {
        try {
            rdfDatatype.parse(lexicalForm);
        } catch (DatatypeFormatException e) {
            throw new MalformedLiteralException(datatype, lexicalForm, e);
        }
    }

    private static Boolean toBoolean(final String lexicalForm) {
        String value = lexicalForm.strip();
        return "true".equals(value) || "1".equals(value);
    }

    private static double toDouble(final String lexicalForm) {
        return switch (lexicalForm) {
            case "INF", "+INF" -> Double.POSITIVE_INFINITY;
            case "-INF" -> Double.NEGATIVE_INFINITY;
            case "NaN" -> Double.NaN;
            default -> Double.parseDouble(lexicalForm);
        };
    }

    private static float toFloat(final String lexicalForm) {
        return switch (lexicalForm) {
            case "INF", "+INF" -> Float.POSITIVE_INFINITY;
            case "-INF" -> Float.NEGATIVE_INFINITY;
            case "NaN" -> Float.NaN;
            default -> Float.parseFloat(lexicalForm);
        };
    }

    private static Object toDate(final String lexicalForm) {
        TemporalAccessor parsed = XSD_DATE.parse(lexicalForm);
        LocalDate date = LocalDate.from(parsed);
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return OffsetDateTime.of(date, LocalTime.MIDNIGHT,
                ZoneOffset.from(parsed));
        }
        return date;
    }

    private static Object toDateTime(final String lexicalForm) {
        String value = lexicalForm;
        int timeStart = value.indexOf('T') + 1;
        Matcher endOfDay = END_OF_DAY.matcher(value)
            .region(timeStart, value.length());
        boolean nextDay = timeStart > 0 && endOfDay.lookingAt();
        if (nextDay) {
            value = value.substring(0, timeStart) + "00:00:00"
                + value.substring(endOfDay.end());
        }
        TemporalAccessor parsed = XSD_DATE_TIME.parse(value);
        LocalDateTime dateTime = LocalDateTime.of(LocalDate.from(parsed),
            LocalTime.from(parsed));
        if (nextDay) {
            dateTime = dateTime.plusDays(1);
        }
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return OffsetDateTime.of(dateTime, ZoneOffset.from(parsed));
        }
        return dateTime;
    }

    private static Object toTime(final String lexicalForm) {
        String value = lexicalForm;
        Matcher endOfDay = END_OF_DAY.matcher(value);
        if (endOfDay.lookingAt()) {
            value = "00:00:00" + value.substring(endOfDay.end());
        }
        TemporalAccessor parsed = XSD_TIME.parse(value);
        LocalTime time = LocalTime.from(parsed);
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return OffsetTime.of(time, ZoneOffset.from(parsed));
        }
        return time;
    }

    private static DateTimeFormatter withOptionalZone(
            final DateTimeFormatterBuilder builder) {
        return builder
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);
    }

    /**
     * A validator paired with a native converter.
     *
     * @param validator the Jena datatype checking the lexical form, or null
     *     when every lexical form is valid
     * @param toNative the conversion to the native value
     */
    private record Coercion(RDFDatatype validator,
                            Function<String, Object> toNative) { }

    /** Lazily created XML duration factory. */
    private static final class DurationFactoryHolder {
        /** Shared factory; thread-safe for {@code newDuration}. */
        private static final DatatypeFactory FACTORY = create();

        private static DatatypeFactory create() {
            try {
                return DatatypeFactory.newInstance();
            } catch (DatatypeConfigurationException e) {
                throw new IllegalStateException(
                    "No javax.xml.datatype implementation available", e);
            }
        }
    }
}
