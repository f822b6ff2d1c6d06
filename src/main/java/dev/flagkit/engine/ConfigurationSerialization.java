package dev.flagkit.engine;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import dev.flagkit.engine.ParseError.Kind;
import dev.flagkit.engine.subsystems.SerializationException;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON reading and writing for configurations, using Gson's streaming API.
 * <p>
 * Reading happens in two phases. The streaming phase turns the JSON text into raw holder objects,
 * recording the JSON path of every field; any failure from Gson in this phase is wrapped in
 * {@link SerializationException}. The resolution phase turns the holders into model objects using
 * the namespace's declared configuration, and reports problems with the content as
 * {@link InvalidSnapshotException}. Neither exception escapes {@link ConfigurationCodec}.
 */
abstract class ConfigurationSerialization {
  private ConfigurationSerialization() {}

  @SuppressWarnings("serial")
  static final class InvalidSnapshotException extends RuntimeException {
    final ParseError error;

    InvalidSnapshotException(ParseError error) {
      super(error.getMessage());
      this.error = error;
    }
  }

  private static InvalidSnapshotException invalid(Kind kind, String message, String path) {
    return new InvalidSnapshotException(ParseError.at(kind, message, path));
  }

  // ---- writing ----

  static String writeConfiguration(Configuration config) {
    StringWriter sw = new StringWriter();
    try (JsonWriter jw = new JsonWriter(sw)) {
      jw.beginObject();
      writeMetadata(jw, config.getMetadata());
      jw.name("flags").beginArray();
      for (FlagDefinition<?> def: config.getFlags().values()) {
        writeFlag(jw, def);
      }
      jw.endArray();
      jw.endObject();
    } catch (IOException | RuntimeException e) {
      throw new SerializationException(e);
    }
    return sw.toString();
  }

  static String writePatch(ConfigurationPatch patch) {
    StringWriter sw = new StringWriter();
    try (JsonWriter jw = new JsonWriter(sw)) {
      jw.beginObject();
      if (patch.getMetadata() != null) {
        writeMetadata(jw, patch.getMetadata());
      }
      jw.name("flags").beginArray();
      for (FlagDefinition<?> def: patch.getUpserts()) {
        writeFlag(jw, def);
      }
      jw.endArray();
      jw.name("removeKeys").beginArray();
      for (FeatureId id: patch.getRemovals()) {
        jw.value(id.encode());
      }
      jw.endArray();
      jw.endObject();
    } catch (IOException | RuntimeException e) {
      throw new SerializationException(e);
    }
    return sw.toString();
  }

  private static void writeMetadata(JsonWriter jw, ConfigurationMetadata meta) throws IOException {
    jw.name("meta").beginObject();
    if (meta.getVersion() != null) {
      jw.name("version").value(meta.getVersion());
    }
    if (meta.getGeneratedAtEpochMillis() != null) {
      jw.name("generatedAtEpochMillis").value(meta.getGeneratedAtEpochMillis().longValue());
    }
    if (meta.getSource() != null) {
      jw.name("source").value(meta.getSource());
    }
    jw.endObject();
  }

  private static void writeFlag(JsonWriter jw, FlagDefinition<?> def) throws IOException {
    jw.beginObject();
    jw.name("key").value(def.getFeature().getId().encode());
    jw.name("defaultValue");
    writeValue(jw, def.getFeature(), def.getDefaultValue());
    jw.name("salt").value(def.getSalt());
    jw.name("isActive").value(def.isActive());
    writeStableIds(jw, "rampUpAllowlist", def.getAllowlist());
    jw.name("rules").beginArray();
    for (Rule<?> rule: def.getRules()) {
      writeRule(jw, def.getFeature(), rule);
    }
    jw.endArray();
    jw.endObject();
  }

  private static void writeRule(JsonWriter jw, Feature<?> feature, Rule<?> rule) throws IOException {
    Targeting t = rule.getTargeting();
    jw.beginObject();
    jw.name("value");
    writeValue(jw, feature, rule.getValue());
    jw.name("rampUp").value(rule.getRollout());
    writeStableIds(jw, "rampUpAllowlist", rule.getAllowlist());
    if (rule.getNote() != null) {
      jw.name("note").value(rule.getNote());
    }
    writeStrings(jw, "locales", t.getLocales());
    writeStrings(jw, "platforms", t.getPlatforms());
    VersionRange range = t.getVersionRange();
    jw.name("versionRange").beginObject();
    jw.name("type").value(range.getKind().name());
    if (range.getMin() != null) {
      jw.name("min");
      writeVersion(jw, range.getMin());
    }
    if (range.getMax() != null) {
      jw.name("max");
      writeVersion(jw, range.getMax());
    }
    jw.endObject();
    jw.name("axes").beginObject();
    for (Map.Entry<String, ? extends Collection<String>> e: t.getAxisConstraints().entrySet()) {
      writeStrings(jw, e.getKey(), e.getValue());
    }
    jw.endObject();
    // custom conditions are code and have no serialized form
    jw.endObject();
  }

  private static void writeValue(JsonWriter jw, Feature<?> feature, Object value) throws IOException {
    jw.beginObject();
    jw.name("type").value(feature.getType().name());
    jw.name("value");
    switch (feature.getType()) {
    case BOOLEAN:
      jw.value(((Boolean)value).booleanValue());
      break;
    case STRING:
      jw.value((String)value);
      break;
    case INT:
      jw.value(((Integer)value).longValue());
      break;
    case DOUBLE:
      jw.value(((Double)value).doubleValue());
      break;
    case ENUM:
      jw.value(((Enum<?>)value).name());
      jw.name("enumClassName").value(feature.getValueClass().getName());
      break;
    default:
      throw new IllegalStateException("unsupported value type " + feature.getType());
    }
    jw.endObject();
  }

  private static void writeVersion(JsonWriter jw, Version v) throws IOException {
    jw.beginObject();
    jw.name("major").value(v.getMajor());
    jw.name("minor").value(v.getMinor());
    jw.name("patch").value(v.getPatch());
    jw.endObject();
  }

  private static void writeStableIds(JsonWriter jw, String name, Collection<StableId> ids) throws IOException {
    jw.name(name).beginArray();
    for (StableId id: ids) {
      jw.value(id.getHexId());
    }
    jw.endArray();
  }

  private static void writeStrings(JsonWriter jw, String name, Collection<String> values) throws IOException {
    jw.name(name).beginArray();
    for (String v: values) {
      jw.value(v);
    }
    jw.endArray();
  }

  // ---- reading: streaming phase ----

  static final class RawDocument {
    ConfigurationMetadata meta;
    final List<RawFlag> flags = new ArrayList<>();
    final List<String> removeKeys = new ArrayList<>();
    final List<String> removeKeyPaths = new ArrayList<>();
    boolean hasFlags;
  }

  static final class RawFlag {
    final String path;
    String key;
    RawValue defaultValue;
    String salt;
    Boolean active;
    final List<String> allowlist = new ArrayList<>();
    final List<String> allowlistPaths = new ArrayList<>();
    final List<RawRule> rules = new ArrayList<>();

    RawFlag(String path) {
      this.path = path;
    }
  }

  static final class RawRule {
    final String path;
    RawValue value;
    Double rampUp;
    String rampUpPath;
    final List<String> allowlist = new ArrayList<>();
    final List<String> allowlistPaths = new ArrayList<>();
    String note;
    final List<String> locales = new ArrayList<>();
    final List<String> platforms = new ArrayList<>();
    RawVersionRange versionRange;
    final Map<String, List<String>> axes = new LinkedHashMap<>();

    RawRule(String path) {
      this.path = path;
    }
  }

  static final class RawValue {
    final String path;
    String type;
    JsonElement value;
    JsonToken compositeValue;
    String enumClassName;

    RawValue(String path) {
      this.path = path;
    }
  }

  static final class RawVersionRange {
    final String path;
    String type;
    RawVersion min;
    RawVersion max;

    RawVersionRange(String path) {
      this.path = path;
    }
  }

  static final class RawVersion {
    final String path;
    Integer major;
    Integer minor;
    Integer patch;

    RawVersion(String path) {
      this.path = path;
    }
  }

  static RawDocument parseDocument(String json) throws SerializationException {
    if (json == null) {
      throw new SerializationException("input was null");
    }
    try {
      JsonReader jr = new JsonReader(new StringReader(json));
      RawDocument doc = new RawDocument();
      jr.beginObject();
      while (jr.peek() != JsonToken.END_OBJECT) {
        String prop = jr.nextName();
        switch (prop) {
        case "meta":
          doc.meta = nullOr(jr) ? null : parseMetadata(jr);
          break;
        case "flags":
          doc.hasFlags = true;
          jr.beginArray();
          while (jr.peek() != JsonToken.END_ARRAY) {
            doc.flags.add(parseFlag(jr));
          }
          jr.endArray();
          break;
        case "removeKeys":
          jr.beginArray();
          while (jr.peek() != JsonToken.END_ARRAY) {
            doc.removeKeyPaths.add(jr.getPath());
            doc.removeKeys.add(nextString(jr));
          }
          jr.endArray();
          break;
        default:
          jr.skipValue();
        }
      }
      jr.endObject();
      if (jr.peek() != JsonToken.END_DOCUMENT) {
        throw new SerializationException("unexpected content after the top-level object at " + jr.getPath());
      }
      return doc;
    } catch (IOException e) {
      throw new SerializationException(e);
    } catch (SerializationException | InvalidSnapshotException e) {
      throw e;
    } catch (RuntimeException e) {
      // A variety of unchecked exceptions can be thrown from JSON parsing; treat them all the same
      throw new SerializationException(e);
    }
  }

  // consumes a JSON null if that is the next token
  private static boolean nullOr(JsonReader jr) throws IOException {
    if (jr.peek() == JsonToken.NULL) {
      jr.nextNull();
      return true;
    }
    return false;
  }

  // JsonReader's next* methods convert between strings and numbers, so check the token first
  private static void expect(JsonReader jr, JsonToken expected, Kind kind) throws IOException {
    JsonToken actual = jr.peek();
    if (actual != expected) {
      throw invalid(kind, "expected " + expected + " but found " + actual, jr.getPath());
    }
  }

  private static String nextString(JsonReader jr) throws IOException {
    expect(jr, JsonToken.STRING, Kind.TYPE_MISMATCH);
    return jr.nextString();
  }

  private static String nextStringOrNull(JsonReader jr) throws IOException {
    return nextStringOrNull(jr, Kind.TYPE_MISMATCH);
  }

  private static String nextStringOrNull(JsonReader jr, Kind kind) throws IOException {
    if (nullOr(jr)) {
      return null;
    }
    expect(jr, JsonToken.STRING, kind);
    return jr.nextString();
  }

  private static ConfigurationMetadata parseMetadata(JsonReader jr) throws IOException {
    String version = null;
    Long generatedAt = null;
    String source = null;
    jr.beginObject();
    while (jr.peek() != JsonToken.END_OBJECT) {
      switch (jr.nextName()) {
      case "version":
        version = nextStringOrNull(jr);
        break;
      case "generatedAtEpochMillis":
        if (!nullOr(jr)) {
          expect(jr, JsonToken.NUMBER, Kind.TYPE_MISMATCH);
          generatedAt = jr.nextLong();
        }
        break;
      case "source":
        source = nextStringOrNull(jr);
        break;
      default:
        jr.skipValue();
      }
    }
    jr.endObject();
    return ConfigurationMetadata.of(version, generatedAt, source);
  }

  private static RawFlag parseFlag(JsonReader jr) throws IOException {
    RawFlag flag = new RawFlag(jr.getPath());
    jr.beginObject();
    while (jr.peek() != JsonToken.END_OBJECT) {
      switch (jr.nextName()) {
      case "key":
        flag.key = nextStringOrNull(jr);
        break;
      case "defaultValue":
        flag.defaultValue = nullOr(jr) ? null : parseValue(jr);
        break;
      case "salt":
        flag.salt = nextStringOrNull(jr);
        break;
      case "isActive":
        if (!nullOr(jr)) {
          expect(jr, JsonToken.BOOLEAN, Kind.TYPE_MISMATCH);
          flag.active = jr.nextBoolean();
        }
        break;
      case "rampUpAllowlist":
        parseStrings(jr, flag.allowlist, flag.allowlistPaths);
        break;
      case "rules":
        if (!nullOr(jr)) {
          jr.beginArray();
          while (jr.peek() != JsonToken.END_ARRAY) {
            flag.rules.add(parseRule(jr));
          }
          jr.endArray();
        }
        break;
      default:
        jr.skipValue();
      }
    }
    jr.endObject();
    return flag;
  }

  private static RawRule parseRule(JsonReader jr) throws IOException {
    RawRule rule = new RawRule(jr.getPath());
    jr.beginObject();
    while (jr.peek() != JsonToken.END_OBJECT) {
      switch (jr.nextName()) {
      case "value":
        rule.value = nullOr(jr) ? null : parseValue(jr);
        break;
      case "rampUp":
        rule.rampUpPath = jr.getPath();
        if (!nullOr(jr)) {
          expect(jr, JsonToken.NUMBER, Kind.TYPE_MISMATCH);
          rule.rampUp = jr.nextDouble();
        }
        break;
      case "rampUpAllowlist":
        parseStrings(jr, rule.allowlist, rule.allowlistPaths);
        break;
      case "note":
        rule.note = nextStringOrNull(jr);
        break;
      case "locales":
        parseStrings(jr, rule.locales, null);
        break;
      case "platforms":
        parseStrings(jr, rule.platforms, null);
        break;
      case "versionRange":
        rule.versionRange = nullOr(jr) ? null : parseVersionRange(jr);
        break;
      case "axes":
        if (!nullOr(jr)) {
          jr.beginObject();
          while (jr.peek() != JsonToken.END_OBJECT) {
            String axisId = jr.nextName();
            List<String> ids = new ArrayList<>();
            parseStrings(jr, ids, null);
            rule.axes.put(axisId, ids);
          }
          jr.endObject();
        }
        break;
      default:
        jr.skipValue();
      }
    }
    jr.endObject();
    return rule;
  }

  private static RawValue parseValue(JsonReader jr) throws IOException {
    RawValue value = new RawValue(jr.getPath());
    jr.beginObject();
    while (jr.peek() != JsonToken.END_OBJECT) {
      switch (jr.nextName()) {
      case "type":
        value.type = nextStringOrNull(jr, Kind.INVALID_SNAPSHOT);
        break;
      case "value":
        // the type may appear after the value, so keep it as a primitive until resolution
        readValueElement(jr, value);
        break;
      case "enumClassName":
        value.enumClassName = nextStringOrNull(jr);
        break;
      default:
        jr.skipValue();
      }
    }
    jr.endObject();
    return value;
  }

  private static void readValueElement(JsonReader jr, RawValue into) throws IOException {
    into.compositeValue = null;
    switch (jr.peek()) {
    case STRING:
      into.value = new JsonPrimitive(jr.nextString());
      break;
    case NUMBER:
      into.value = new JsonPrimitive(new BigDecimal(jr.nextString()));
      break;
    case BOOLEAN:
      into.value = new JsonPrimitive(jr.nextBoolean());
      break;
    case NULL:
      jr.nextNull();
      into.value = JsonNull.INSTANCE;
      break;
    default:
      into.compositeValue = jr.peek();
      into.value = null;
      jr.skipValue();
    }
  }

  private static RawVersionRange parseVersionRange(JsonReader jr) throws IOException {
    RawVersionRange range = new RawVersionRange(jr.getPath());
    jr.beginObject();
    while (jr.peek() != JsonToken.END_OBJECT) {
      switch (jr.nextName()) {
      case "type":
        range.type = nextStringOrNull(jr, Kind.INVALID_VERSION);
        break;
      case "min":
        range.min = nullOr(jr) ? null : parseVersion(jr);
        break;
      case "max":
        range.max = nullOr(jr) ? null : parseVersion(jr);
        break;
      default:
        jr.skipValue();
      }
    }
    jr.endObject();
    return range;
  }

  private static RawVersion parseVersion(JsonReader jr) throws IOException {
    RawVersion v = new RawVersion(jr.getPath());
    jr.beginObject();
    while (jr.peek() != JsonToken.END_OBJECT) {
      switch (jr.nextName()) {
      case "major":
        v.major = nextVersionComponent(jr);
        break;
      case "minor":
        v.minor = nextVersionComponent(jr);
        break;
      case "patch":
        v.patch = nextVersionComponent(jr);
        break;
      default:
        jr.skipValue();
      }
    }
    jr.endObject();
    if (v.major == null || v.minor == null || v.patch == null) {
      throw invalid(Kind.INVALID_VERSION, "version requires \"major\", \"minor\" and \"patch\"", v.path);
    }
    return v;
  }

  private static int nextVersionComponent(JsonReader jr) throws IOException {
    expect(jr, JsonToken.NUMBER, Kind.INVALID_VERSION);
    String path = jr.getPath();
    try {
      return jr.nextInt();
    } catch (NumberFormatException e) {
      throw invalid(Kind.INVALID_VERSION, "version component is not an integer", path);
    }
  }

  private static void parseStrings(JsonReader jr, List<String> into, List<String> paths) throws IOException {
    if (nullOr(jr)) {
      return;
    }
    jr.beginArray();
    while (jr.peek() != JsonToken.END_ARRAY) {
      if (paths != null) {
        paths.add(jr.getPath());
      }
      into.add(nextString(jr));
    }
    jr.endArray();
  }

  // ---- reading: resolution phase ----

  static Configuration toConfiguration(RawDocument doc, Configuration declared, SnapshotLoadOptions options)
      throws InvalidSnapshotException {
    if (!doc.hasFlags) {
      throw invalid(Kind.INVALID_SNAPSHOT, "snapshot has no \"flags\" array", "$");
    }
    Configuration.Builder b = Configuration.builder();
    if (doc.meta != null) {
      b.metadata(doc.meta);
    }
    Map<FeatureId, FlagDefinition<?>> loaded = resolveFlags(doc, declared, options);
    b.putAll(loaded.values());
    for (FlagDefinition<?> def: declared.getFlags().values()) {
      FeatureId id = def.getFeature().getId();
      if (loaded.containsKey(id)) {
        continue;
      }
      if (!options.isFillMissingDeclaredFlags()) {
        throw invalid(Kind.INVALID_SNAPSHOT, "snapshot does not contain declared flag \"" + id + "\"", "$.flags");
      }
      options.warn(id.encode(), "flag is missing from the snapshot; keeping its declared definition");
      b.put(def);
    }
    return b.build();
  }

  static ConfigurationPatch toPatch(RawDocument doc, Configuration declared, SnapshotLoadOptions options)
      throws InvalidSnapshotException {
    ConfigurationPatch.Builder b = ConfigurationPatch.builder();
    if (doc.meta != null) {
      b.metadata(doc.meta);
    }
    for (FlagDefinition<?> def: resolveFlags(doc, declared, options).values()) {
      b.upsert(def);
    }
    for (int i = 0; i < doc.removeKeys.size(); i++) {
      FlagDefinition<?> def = lookup(doc.removeKeys.get(i), doc.removeKeyPaths.get(i), declared, options);
      if (def != null) {
        b.remove(def.getFeature().getId());
      }
    }
    return b.build();
  }

  private static Map<FeatureId, FlagDefinition<?>> resolveFlags(RawDocument doc, Configuration declared,
      SnapshotLoadOptions options) {
    Map<FeatureId, FlagDefinition<?>> result = new LinkedHashMap<>();
    for (RawFlag raw: doc.flags) {
      if (raw.key == null) {
        throw invalid(Kind.INVALID_SNAPSHOT, "flag entry has no key", raw.path);
      }
      FlagDefinition<?> declaredDef = lookup(raw.key, raw.path + ".key", declared, options);
      if (declaredDef == null) {
        continue;
      }
      FeatureId id = declaredDef.getFeature().getId();
      if (result.containsKey(id)) {
        throw invalid(Kind.INVALID_SNAPSHOT, "flag \"" + raw.key + "\" appears more than once", raw.path + ".key");
      }
      result.put(id, toDefinition(declaredDef.getFeature(), raw));
    }
    return result;
  }

  // returns null if the key is unknown and the options allow skipping it
  private static FlagDefinition<?> lookup(String key, String path, Configuration declared,
      SnapshotLoadOptions options) {
    FeatureId id;
    try {
      id = FeatureId.parse(key);
    } catch (IllegalArgumentException e) {
      throw invalid(Kind.INVALID_SNAPSHOT, "malformed flag key \"" + key + "\": " + e.getMessage(), path);
    }
    FlagDefinition<?> def = declared.get(id);
    if (def == null) {
      if (options.isSkipUnknownKeys()) {
        options.warn(key, "flag is not declared in this namespace; skipped");
        return null;
      }
      throw invalid(Kind.FEATURE_NOT_FOUND, "flag \"" + key + "\" is not declared in this namespace", path);
    }
    return def;
  }

  private static <T> FlagDefinition<T> toDefinition(Feature<T> feature, RawFlag raw) {
    if (raw.defaultValue == null) {
      throw invalid(Kind.INVALID_SNAPSHOT, "flag \"" + raw.key + "\" has no defaultValue", raw.path);
    }
    FlagDefinition.Builder<T> b = FlagDefinition.builder(feature, toValue(feature, raw.defaultValue));
    if (raw.active != null) {
      b.active(raw.active);
    }
    if (raw.salt != null) {
      if (raw.salt.isEmpty()) {
        throw invalid(Kind.INVALID_SNAPSHOT, "salt must not be empty", raw.path + ".salt");
      }
      b.salt(raw.salt);
    }
    b.allowlist(toStableIds(raw.allowlist, raw.allowlistPaths));
    for (RawRule rule: raw.rules) {
      b.rule(toRule(feature, rule));
    }
    return b.build();
  }

  private static <T> Rule<T> toRule(Feature<T> feature, RawRule raw) {
    if (raw.value == null) {
      throw invalid(Kind.INVALID_SNAPSHOT, "rule has no value", raw.path);
    }
    Rule.Builder<T> b = Rule.builder(toValue(feature, raw.value));
    if (raw.rampUp != null) {
      if (!Rule.isValidRollout(raw.rampUp)) {
        throw invalid(Kind.INVALID_ROLLOUT, "rampUp must be between 0 and 100, was " + raw.rampUp, raw.rampUpPath);
      }
      b.rollout(raw.rampUp);
    }
    b.allowlist(toStableIds(raw.allowlist, raw.allowlistPaths));
    b.note(raw.note);

    Targeting.Builder t = Targeting.builder()
        .locales(raw.locales)
        .platforms(raw.platforms);
    if (raw.versionRange != null) {
      t.versions(toVersionRange(raw.versionRange));
    }
    for (Map.Entry<String, List<String>> e: raw.axes.entrySet()) {
      if (e.getValue().isEmpty()) {
        throw invalid(Kind.INVALID_SNAPSHOT, "axis \"" + e.getKey() + "\" has no values", raw.path + ".axes");
      }
      t.axis(e.getKey(), e.getValue());
    }
    return b.targeting(t.build()).build();
  }

  private static VersionRange toVersionRange(RawVersionRange raw) {
    if (raw.type == null) {
      throw invalid(Kind.INVALID_VERSION, "version range has no type", raw.path);
    }
    VersionRange.Kind kind;
    try {
      kind = VersionRange.Kind.valueOf(raw.type);
    } catch (IllegalArgumentException e) {
      throw invalid(Kind.INVALID_VERSION, "unknown version range type \"" + raw.type + "\"", raw.path + ".type");
    }
    switch (kind) {
    case UNBOUNDED:
      return VersionRange.unbounded();
    case MIN_BOUND:
      return VersionRange.atLeast(toVersion(requireBound(raw.min, "min", raw)));
    case MAX_BOUND:
      return VersionRange.atMost(toVersion(requireBound(raw.max, "max", raw)));
    case MIN_AND_MAX_BOUND:
      Version min = toVersion(requireBound(raw.min, "min", raw));
      Version max = toVersion(requireBound(raw.max, "max", raw));
      if (min.compareTo(max) > 0) {
        throw invalid(Kind.INVALID_VERSION, "minimum " + min + " is greater than maximum " + max, raw.path);
      }
      return VersionRange.between(min, max);
    default:
      throw new IllegalStateException("unsupported version range type " + kind);
    }
  }

  private static RawVersion requireBound(RawVersion bound, String name, RawVersionRange range) {
    if (bound == null) {
      throw invalid(Kind.INVALID_VERSION, range.type + " range requires \"" + name + "\"", range.path);
    }
    return bound;
  }

  private static Version toVersion(RawVersion raw) {
    if (raw.major < 0 || raw.minor < 0 || raw.patch < 0) {
      throw invalid(Kind.INVALID_VERSION, "version components must not be negative", raw.path);
    }
    return Version.of(raw.major, raw.minor, raw.patch);
  }

  private static List<StableId> toStableIds(List<String> hexIds, List<String> paths) {
    List<StableId> ret = new ArrayList<>(hexIds.size());
    for (int i = 0; i < hexIds.size(); i++) {
      ParseResult<StableId> id = StableId.parseHex(hexIds.get(i));
      if (!id.isSuccess()) {
        throw invalid(Kind.INVALID_HEX_ID, id.getError().getMessage(), paths.get(i));
      }
      ret.add(id.getValue());
    }
    return ret;
  }

  private static <T> T toValue(Feature<T> feature, RawValue raw) {
    if (raw.type == null) {
      throw invalid(Kind.INVALID_SNAPSHOT, "value has no type", raw.path);
    }
    FlagValueType type;
    try {
      type = FlagValueType.valueOf(raw.type);
    } catch (IllegalArgumentException e) {
      throw invalid(Kind.INVALID_SNAPSHOT, "unknown value type \"" + raw.type + "\"", raw.path + ".type");
    }
    if (type != feature.getType()) {
      throw invalid(Kind.TYPE_MISMATCH, "flag \"" + feature.getId() + "\" has type " + feature.getType() +
          " but the snapshot has " + type, raw.path + ".type");
    }
    if (raw.compositeValue != null) {
      throw invalid(Kind.TYPE_MISMATCH, "flag \"" + feature.getId() + "\" expects a " + feature.getType() +
          " value but got " + raw.compositeValue, raw.path + ".value");
    }
    if (raw.value == null || raw.value.isJsonNull()) {
      throw invalid(Kind.INVALID_SNAPSHOT, "value is missing", raw.path);
    }
    String valuePath = raw.path + ".value";
    JsonPrimitive p = raw.value.isJsonPrimitive() ? raw.value.getAsJsonPrimitive() : null;
    Object value;
    switch (type) {
    case BOOLEAN:
      if (p == null || !p.isBoolean()) {
        throw typeMismatch(feature, raw, valuePath);
      }
      value = p.getAsBoolean();
      break;
    case STRING:
      if (p == null || !p.isString()) {
        throw typeMismatch(feature, raw, valuePath);
      }
      value = p.getAsString();
      break;
    case INT:
      if (p == null || !p.isNumber()) {
        throw typeMismatch(feature, raw, valuePath);
      }
      try {
        value = p.getAsBigDecimal().intValueExact();
      } catch (ArithmeticException | NumberFormatException e) {
        throw invalid(Kind.TYPE_MISMATCH, "value " + p + " is not a 32-bit integer", valuePath);
      }
      break;
    case DOUBLE:
      if (p == null || !p.isNumber()) {
        throw typeMismatch(feature, raw, valuePath);
      }
      BigDecimal bd;
      try {
        bd = p.getAsBigDecimal();
      } catch (NumberFormatException e) {
        throw invalid(Kind.TYPE_MISMATCH, "value " + p + " is not a finite number", valuePath);
      }
      value = bd.doubleValue();
      break;
    case ENUM:
      if (p == null || !p.isString()) {
        throw typeMismatch(feature, raw, valuePath);
      }
      if (raw.enumClassName != null && !raw.enumClassName.equals(feature.getValueClass().getName())) {
        throw invalid(Kind.TYPE_MISMATCH, "flag \"" + feature.getId() + "\" uses " + feature.getValueClass().getName() +
            " but the snapshot names " + raw.enumClassName, raw.path + ".enumClassName");
      }
      value = enumConstant(feature.getValueClass(), p.getAsString());
      if (value == null) {
        throw invalid(Kind.TYPE_MISMATCH, "\"" + p.getAsString() + "\" is not a constant of " +
            feature.getValueClass().getName(), valuePath);
      }
      break;
    default:
      throw new IllegalStateException("unsupported value type " + type);
    }
    try {
      return feature.checkValue(value);
    } catch (IllegalArgumentException e) {
      throw invalid(Kind.TYPE_MISMATCH, e.getMessage(), valuePath);
    }
  }

  private static InvalidSnapshotException typeMismatch(Feature<?> feature, RawValue raw, String path) {
    return invalid(Kind.TYPE_MISMATCH, "flag \"" + feature.getId() + "\" expects a " + feature.getType() +
        " value but got " + raw.value, path);
  }

  private static Object enumConstant(Class<?> enumClass, String name) {
    for (Object c: enumClass.getEnumConstants()) {
      if (((Enum<?>)c).name().equals(name)) {
        return c;
      }
    }
    return null;
  }

  static ParseError toParseError(SerializationException e) {
    Throwable cause = e.getCause() == null ? e : e.getCause();
    String message = cause.getMessage() == null ? cause.toString() : cause.getMessage();
    return ParseError.of(Kind.INVALID_JSON, message);
  }
}
