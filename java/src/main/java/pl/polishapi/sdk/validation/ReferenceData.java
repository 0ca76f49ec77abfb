package pl.polishapi.sdk.validation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Properties;
import java.util.Set;

/**
 * Read-only ISO reference tables bundled with the SDK. Loaded once when the class initialises.
 */
public final class ReferenceData {

    private static final Set<String> CURRENCIES = readCodes("iso4217-currencies.txt");
    private static final Set<String> COUNTRIES = readCodes("iso3166-countries.txt");
    private static final Map<String, Integer> IBAN_LENGTHS = readIbanRegistry("iban-registry.properties");

    private ReferenceData() {
    }

    public static boolean isCurrencyCode(String code) {
        return code != null && CURRENCIES.contains(code);
    }

    public static boolean isCountryCode(String code) {
        return code != null && COUNTRIES.contains(code);
    }

    /**
     * @return the registered IBAN length for the country prefix, empty when the country is not in the registry.
     */
    public static OptionalInt ibanLength(String countryCode) {
        Integer length = IBAN_LENGTHS.get(countryCode);
        return length == null ? OptionalInt.empty() : OptionalInt.of(length);
    }

    public static Set<String> currencyCodes() {
        return CURRENCIES;
    }

    public static Set<String> countryCodes() {
        return COUNTRIES;
    }

    private static Set<String> readCodes(String resource) {
        Set<String> codes = new HashSet<>();
        try (InputStream in = open(resource);
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.US_ASCII))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    codes.add(trimmed);
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException("read reference table " + resource, ex);
        }
        return Set.copyOf(codes);
    }

    private static Map<String, Integer> readIbanRegistry(String resource) {
        Properties properties = new Properties();
        try (InputStream in = open(resource)) {
            properties.load(in);
        } catch (IOException ex) {
            throw new IllegalStateException("read reference table " + resource, ex);
        }
        Map<String, Integer> lengths = new HashMap<>();
        for (String country : properties.stringPropertyNames()) {
            lengths.put(country, Integer.parseInt(properties.getProperty(country).trim()));
        }
        return Map.copyOf(lengths);
    }

    private static InputStream open(String resource) {
        InputStream in = ReferenceData.class.getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("missing reference table " + resource);
        }
        return in;
    }
}
