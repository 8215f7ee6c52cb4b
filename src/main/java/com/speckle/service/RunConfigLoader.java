package com.speckle.service;

import com.speckle.error.ConfigurationException;
import com.speckle.model.InstrumentFamily;
import com.speckle.model.KisipEnv;
import com.speckle.model.KisipMethod;
import com.speckle.model.KisipProps;
import com.speckle.model.RunConfig;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

// SECTION.key=value; KISIP_* sections are shared by all instruments.
public class RunConfigLoader {

    // Sections
    private static final String SEC_METHOD = "KISIP_METHOD";
    private static final String SEC_PROPS = "KISIP_PROPS";
    private static final String SEC_ENV = "KISIP_ENV";

    // Instrument keys
    private static final String KEY_DARK_BASE = "darkBase";
    private static final String KEY_DATA_BASE = "dataBase";
    private static final String KEY_FLAT_BASE = "flatBase";
    private static final String KEY_WORK_BASE = "workBase";
    private static final String KEY_BURST_NUMBER = "burstNumber";
    private static final String KEY_BURST_FORM = "burstFileForm";
    private static final String KEY_SPECKLED_FORM = "speckledFileForm";
    private static final String KEY_OBS_DATE = "obsDate";
    private static final String KEY_OBS_TIME = "obsTime";
    private static final String KEY_EXP_TIME = "expTimems";
    private static final String KEY_DARK_PATTERN = "darkFilePattern";
    private static final String KEY_DATA_PATTERN = "dataFilePattern";
    private static final String KEY_FLAT_PATTERN = "flatFilePattern";
    private static final String KEY_NOISE_FILE = "noiseFile";
    private static final String KEY_WAVELENGTH = "wavelengthnm";
    private static final String KEY_ARCSEC_X = "kisipArcsecPerPixX";
    private static final String KEY_ARCSEC_Y = "kisipArcsecPerPixY";
    private static final String KEY_SUBFIELD = "kisipMethodSubfieldArcsec";
    private static final String KEY_SAVE_BURSTS = "saveBursts";

    public RunConfig load(Path configFile, String instrument) throws ConfigurationException {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Configuration file does not exist: " + configFile);
        }
        Properties p = new Properties();
        try (Reader r = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            p.load(r);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read configuration file: " + configFile, e);
        }
        return fromProperties(p, instrument);
    }

    public RunConfig fromProperties(Properties p, String instrument) throws ConfigurationException {
        String sec = instrument.toUpperCase(Locale.ROOT);
        try {
            InstrumentFamily.of(sec);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        // Subfield size lives with the instrument in practice; fall back to the method section.
        String subfield = optional(p, sec, KEY_SUBFIELD);
        if (subfield == null) subfield = required(p, SEC_METHOD, KEY_SUBFIELD);

        KisipMethod method = new KisipMethod(
                requiredNumber(p, SEC_METHOD, "kisipMethodMethod"),
                checkNumber(SEC_METHOD, KEY_SUBFIELD, subfield),
                requiredNumber(p, SEC_METHOD, "kisipMethodPhaseRecLimit"),
                requiredNumber(p, SEC_METHOD, "kisipMethodUX"),
                requiredNumber(p, SEC_METHOD, "kisipMethodUV"),
                requiredNumber(p, SEC_METHOD, "kisipMethodMaxIter"),
                requiredNumber(p, SEC_METHOD, "kisipMethodSNThresh"),
                requiredNumber(p, SEC_METHOD, "kisipMethodWeightExp"),
                requiredNumber(p, SEC_METHOD, "kisipMethodPhaseRecApod"),
                requiredNumber(p, SEC_METHOD, "kisipMethodNoiseFilter"));

        KisipProps props = new KisipProps(
                requiredNumber(p, SEC_PROPS, "kisipPropsHeaderOff"),
                requiredNumber(p, SEC_PROPS, "kisipPropsTelescopeDiamm"),
                requiredNumber(p, SEC_PROPS, "kisipPropsAoLockX"),
                requiredNumber(p, SEC_PROPS, "kisipPropsAoLockY"),
                requiredNumber(p, SEC_PROPS, "kisipPropsAoUsed"));

        KisipEnv env = new KisipEnv(
                Paths.get(required(p, SEC_ENV, "kisipEnvBin")),
                Paths.get(required(p, SEC_ENV, "kisipEnvLib")),
                requiredInt(p, SEC_ENV, "kisipEnvMpiNproc"),
                required(p, SEC_ENV, "kisipEnvMpirun"),
                required(p, SEC_ENV, "kisipEnvKisipExe"));

        // Exposure time only feeds the reconstructed Zyla timestamps.
        String exp = optional(p, sec, KEY_EXP_TIME);
        int expTimeMs = 0;
        if (exp != null) expTimeMs = parseInt(sec, KEY_EXP_TIME, exp);
        else if (InstrumentFamily.of(sec) == InstrumentFamily.RAW_BUFFER) required(p, sec, KEY_EXP_TIME);

        String obsDate = required(p, sec, KEY_OBS_DATE);
        String obsTime = required(p, sec, KEY_OBS_TIME);
        if (!obsDate.matches("\\d{8}")) throw new ConfigurationException(sec + "." + KEY_OBS_DATE + " must be yyyyMMdd: " + obsDate);
        if (!obsTime.matches("\\d{6}")) throw new ConfigurationException(sec + "." + KEY_OBS_TIME + " must be HHmmss: " + obsTime);

        int burstNumber = requiredInt(p, sec, KEY_BURST_NUMBER);
        if (burstNumber <= 0) throw new ConfigurationException(sec + "." + KEY_BURST_NUMBER + " must be positive: " + burstNumber);

        String save = optional(p, sec, KEY_SAVE_BURSTS);

        return new RunConfig.Builder()
                .instrument(sec)
                .darkBase(Paths.get(required(p, sec, KEY_DARK_BASE)))
                .dataBase(Paths.get(required(p, sec, KEY_DATA_BASE)))
                .flatBase(Paths.get(required(p, sec, KEY_FLAT_BASE)))
                .workBase(Paths.get(required(p, sec, KEY_WORK_BASE)))
                .darkFilePattern(required(p, sec, KEY_DARK_PATTERN))
                .dataFilePattern(required(p, sec, KEY_DATA_PATTERN))
                .flatFilePattern(required(p, sec, KEY_FLAT_PATTERN))
                .burstNumber(burstNumber)
                .burstFileForm(requiredForm(p, sec, KEY_BURST_FORM))
                .speckledFileForm(requiredForm(p, sec, KEY_SPECKLED_FORM))
                .obsDate(obsDate)
                .obsTime(obsTime)
                .expTimeMs(expTimeMs)
                .noiseFile(required(p, sec, KEY_NOISE_FILE))
                .wavelengthNm(requiredNumber(p, sec, KEY_WAVELENGTH))
                .arcsecPerPix(requiredNumber(p, sec, KEY_ARCSEC_X), requiredNumber(p, sec, KEY_ARCSEC_Y))
                .method(method)
                .props(props)
                .env(env)
                .saveBursts(save == null || Boolean.parseBoolean(save))
                .build();
    }

    // --- HELPERS ---

    private static String optional(Properties p, String section, String key) {
        String v = p.getProperty(section + "." + key);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static String required(Properties p, String section, String key) throws ConfigurationException {
        String v = optional(p, section, key);
        if (v == null) throw new ConfigurationException("Missing configuration value: " + section + "." + key);
        return v;
    }

    private static int requiredInt(Properties p, String section, String key) throws ConfigurationException {
        return parseInt(section, key, required(p, section, key));
    }

    // KISIP reads these itself, so the text is checked but passed on unchanged.
    private static String requiredNumber(Properties p, String section, String key) throws ConfigurationException {
        return checkNumber(section, key, required(p, section, key));
    }

    private static String checkNumber(String section, String key, String v) throws ConfigurationException {
        try {
            Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Not a number: " + section + "." + key + "=" + v, e);
        }
        return v;
    }

    private static int parseInt(String section, String key, String v) throws ConfigurationException {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Not an integer: " + section + "." + key + "=" + v, e);
        }
    }

    // File forms must accept (date, time, batch, index) and end in a three-digit index.
    private static String requiredForm(Properties p, String section, String key) throws ConfigurationException {
        String form = required(p, section, key);
        try {
            String sample = String.format(Locale.ROOT, form, "20000101", "000000", 0, 0);
            if (!sample.endsWith(".000")) {
                throw new ConfigurationException(section + "." + key + " must end with a .%03d index: " + form);
            }
        } catch (java.util.IllegalFormatException e) {
            throw new ConfigurationException("Bad file form " + section + "." + key + "=" + form, e);
        }
        return form;
    }
}
