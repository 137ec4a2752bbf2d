package ai.schemagen.config;

import static ai.schemagen.model.CanonicalRole.ADJECTIVE;
import static ai.schemagen.model.CanonicalRole.BASE;
import static ai.schemagen.model.CanonicalRole.PASSIVE_VERB;
import static ai.schemagen.model.CanonicalRole.PROPERTY;
import static ai.schemagen.model.CanonicalRole.REVERSE_PROPERTY;
import static ai.schemagen.model.CanonicalRole.VERB;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.schemagen.model.CanonicalRecord;
import ai.schemagen.model.SemanticType;

/**
 * Immutable configuration shared by the classifier, resolver, synthesizer and emitter.
 * <p>
 * Every override table is a named field. {@link #defaults()} carries the schema.org tables;
 * {@link #toBuilder()} derives variants (tests, {@link ConfigLoader}).
 */
public final class ResolverConfig {

    private final Set<String> blockedClasses;
    private final Set<String> blockedProperties;
    private final List<String> structRoots;
    private final Set<String> nonStructTypes;
    private final Set<String> forceArrayProperties;
    private final Set<String> forceNotArrayProperties;
    private final Map<String, SemanticType> propertyTypeOverrides;
    private final Map<String, CanonicalRecord> canonicalOverrides;
    private final Map<String, CanonicalRecord> manualCanonicalOverrides;
    private final Set<String> noFilterProperties;
    private final Set<String> dropWithGeoProperties;
    private final Set<String> structIncludeRootProperties;
    private final Map<String, String> stringValueOverrides;
    private final Set<String> reservedWords;
    private final Map<String, SemanticType> builtinTypes;
    private final List<String> collectionSuffixes;
    private final String rootType;
    private final String actionRoot;
    private final String enumerationRoot;
    private final String collectionRoot;
    private final String textType;
    private final String ambiguousNumericType;
    private final String classPrefix;
    private final boolean manual;
    private final boolean alwaysBaseCanonical;

    private ResolverConfig(Builder b) {
        this.blockedClasses = Set.copyOf(b.blockedClasses);
        this.blockedProperties = Set.copyOf(b.blockedProperties);
        this.structRoots = List.copyOf(b.structRoots);
        this.nonStructTypes = Set.copyOf(b.nonStructTypes);
        this.forceArrayProperties = Set.copyOf(b.forceArrayProperties);
        this.forceNotArrayProperties = Set.copyOf(b.forceNotArrayProperties);
        this.propertyTypeOverrides = Map.copyOf(b.propertyTypeOverrides);
        this.canonicalOverrides = Map.copyOf(b.canonicalOverrides);
        this.manualCanonicalOverrides = Map.copyOf(b.manualCanonicalOverrides);
        this.noFilterProperties = Set.copyOf(b.noFilterProperties);
        this.dropWithGeoProperties = Set.copyOf(b.dropWithGeoProperties);
        this.structIncludeRootProperties = Set.copyOf(b.structIncludeRootProperties);
        this.stringValueOverrides = Map.copyOf(b.stringValueOverrides);
        this.reservedWords = Set.copyOf(b.reservedWords);
        this.builtinTypes = Map.copyOf(b.builtinTypes);
        this.collectionSuffixes = List.copyOf(b.collectionSuffixes);
        this.rootType = Objects.requireNonNull(b.rootType, "rootType");
        this.actionRoot = Objects.requireNonNull(b.actionRoot, "actionRoot");
        this.enumerationRoot = Objects.requireNonNull(b.enumerationRoot, "enumerationRoot");
        this.collectionRoot = Objects.requireNonNull(b.collectionRoot, "collectionRoot");
        this.textType = Objects.requireNonNull(b.textType, "textType");
        this.ambiguousNumericType = Objects.requireNonNull(b.ambiguousNumericType, "ambiguousNumericType");
        this.classPrefix = Objects.requireNonNull(b.classPrefix, "classPrefix");
        this.manual = b.manual;
        this.alwaysBaseCanonical = b.alwaysBaseCanonical;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        final Builder b = new Builder();
        b.blockedClasses.addAll(blockedClasses);
        b.blockedProperties.addAll(blockedProperties);
        b.structRoots.addAll(structRoots);
        b.nonStructTypes.addAll(nonStructTypes);
        b.forceArrayProperties.addAll(forceArrayProperties);
        b.forceNotArrayProperties.addAll(forceNotArrayProperties);
        b.propertyTypeOverrides.putAll(propertyTypeOverrides);
        b.canonicalOverrides.putAll(canonicalOverrides);
        b.manualCanonicalOverrides.putAll(manualCanonicalOverrides);
        b.noFilterProperties.addAll(noFilterProperties);
        b.dropWithGeoProperties.addAll(dropWithGeoProperties);
        b.structIncludeRootProperties.addAll(structIncludeRootProperties);
        b.stringValueOverrides.putAll(stringValueOverrides);
        b.reservedWords.addAll(reservedWords);
        b.builtinTypes.putAll(builtinTypes);
        b.collectionSuffixes.addAll(collectionSuffixes);
        b.rootType = rootType;
        b.actionRoot = actionRoot;
        b.enumerationRoot = enumerationRoot;
        b.collectionRoot = collectionRoot;
        b.textType = textType;
        b.ambiguousNumericType = ambiguousNumericType;
        b.classPrefix = classPrefix;
        b.manual = manual;
        b.alwaysBaseCanonical = alwaysBaseCanonical;
        return b;
    }

    public Set<String> blockedClasses() {
        return blockedClasses;
    }

    public Set<String> blockedProperties() {
        return blockedProperties;
    }

    public List<String> structRoots() {
        return structRoots;
    }

    public Set<String> nonStructTypes() {
        return nonStructTypes;
    }

    public Set<String> forceArrayProperties() {
        return forceArrayProperties;
    }

    public Set<String> forceNotArrayProperties() {
        return forceNotArrayProperties;
    }

    public Map<String, SemanticType> propertyTypeOverrides() {
        return propertyTypeOverrides;
    }

    public Map<String, CanonicalRecord> canonicalOverrides() {
        return canonicalOverrides;
    }

    public Map<String, CanonicalRecord> manualCanonicalOverrides() {
        return manualCanonicalOverrides;
    }

    public Set<String> noFilterProperties() {
        return noFilterProperties;
    }

    public Set<String> dropWithGeoProperties() {
        return dropWithGeoProperties;
    }

    public Set<String> structIncludeRootProperties() {
        return structIncludeRootProperties;
    }

    public Map<String, String> stringValueOverrides() {
        return stringValueOverrides;
    }

    public Set<String> reservedWords() {
        return reservedWords;
    }

    public Map<String, SemanticType> builtinTypes() {
        return builtinTypes;
    }

    public List<String> collectionSuffixes() {
        return collectionSuffixes;
    }

    public String rootType() {
        return rootType;
    }

    public String actionRoot() {
        return actionRoot;
    }

    public String enumerationRoot() {
        return enumerationRoot;
    }

    public String collectionRoot() {
        return collectionRoot;
    }

    public String textType() {
        return textType;
    }

    public String ambiguousNumericType() {
        return ambiguousNumericType;
    }

    public String classPrefix() {
        return classPrefix;
    }

    public boolean manual() {
        return manual;
    }

    public boolean alwaysBaseCanonical() {
        return alwaysBaseCanonical;
    }

    public boolean isBuiltin(String typeName) {
        return builtinTypes.containsKey(typeName);
    }

    public boolean isStructRoot(String typeName) {
        return structRoots.contains(typeName);
    }

    /**
     * Tables for the schema.org vocabulary.
     */
    public static ResolverConfig defaults() {
        final Builder b = new Builder();

        b.builtinTypes.put("Time", SemanticType.TIME);
        b.builtinTypes.put("Number", SemanticType.NUMBER);
        b.builtinTypes.put("Float", SemanticType.NUMBER);
        b.builtinTypes.put("Integer", SemanticType.NUMBER);
        b.builtinTypes.put("Text", SemanticType.STRING);
        b.builtinTypes.put("Boolean", SemanticType.BOOLEAN);
        b.builtinTypes.put("DateTime", SemanticType.DATE);
        b.builtinTypes.put("Date", SemanticType.DATE);
        b.builtinTypes.put("DataType", SemanticType.ANY);
        b.builtinTypes.put("URL", new SemanticType.Entity("tt:url"));
        b.builtinTypes.put("ImageObject", new SemanticType.Entity("tt:picture"));
        b.builtinTypes.put("Barcode", new SemanticType.Entity("tt:picture"));
        b.builtinTypes.put("Mass", new SemanticType.Measure("kg"));
        b.builtinTypes.put("Energy", new SemanticType.Measure("kcal"));
        b.builtinTypes.put("Distance", new SemanticType.Measure("m"));
        b.builtinTypes.put("Duration", new SemanticType.Measure("ms"));
        b.builtinTypes.put("GeoCoordinates", SemanticType.LOCATION);
        b.builtinTypes.put("MonetaryAmount", SemanticType.CURRENCY);
        b.builtinTypes.put("QuantitativeValue", SemanticType.ANY);

        b.reservedWords.addAll(List.of(
                "let", "now", "new", "as", "of", "in", "out", "req", "opt", "notify", "return",
                "join", "edge", "monitor", "class", "extends", "mixin", "this", "import", "null",
                "enum", "aggregate", "dataset", "oninput", "sort", "asc", "desc", "bookkeeping",
                "compute", "true", "false"));

        b.blockedClasses.addAll(List.of(
                "QualitativeValue", "PropertyValue", "BedType", "MedicalBusiness",
                // turns Audience into an enum
                "Researcher"));

        b.blockedProperties.addAll(List.of(
                "sameAs", "affiliation", "mainEntityOfPage", "embedUrl",
                "itemReviewed",
                // range of rating
                "bestRating", "worstRating",
                // renamed to description during normalization
                "reviewBody",
                // loop in PriceSpecification
                "eligibleTransactionVolume",
                // loop in Offer
                "addOn",
                "areaServed",
                // handled by normalization
                "priceCurrency"));

        b.structRoots.addAll(List.of("StructuredValue", "Rating", "Offer"));

        b.forceArrayProperties.addAll(List.of("worksFor", "recipeCuisine", "recipeCategory"));
        b.forceNotArrayProperties.add("offers");

        b.propertyTypeOverrides.put("telephone", new SemanticType.Entity("tt:phone_number"));
        b.propertyTypeOverrides.put("email", new SemanticType.Entity("tt:email_address"));
        b.propertyTypeOverrides.put("image", new SemanticType.Entity("tt:picture"));
        b.propertyTypeOverrides.put("logo", new SemanticType.Entity("tt:picture"));
        b.propertyTypeOverrides.put("checkinTime", SemanticType.TIME);
        b.propertyTypeOverrides.put("checkoutTime", SemanticType.TIME);
        b.propertyTypeOverrides.put("price", SemanticType.CURRENCY);
        b.propertyTypeOverrides.put("weight", new SemanticType.Measure("ms"));
        b.propertyTypeOverrides.put("depth", new SemanticType.Measure("m"));
        b.propertyTypeOverrides.put("description", SemanticType.STRING);
        b.propertyTypeOverrides.put("addressCountry", new SemanticType.Entity("tt:country"));
        b.propertyTypeOverrides.put("addressRegion", new SemanticType.Entity("tt:us_state"));
        b.propertyTypeOverrides.put("video", new SemanticType.Entity("org.schema:VideoObject"));
        b.propertyTypeOverrides.put("publisher", new SemanticType.Entity("org.schema:Organization"));
        b.propertyTypeOverrides.put("recipeYield", SemanticType.STRING);

        b.canonicalOverrides.put("url", CanonicalRecord.builder()
                .addAll(BASE, "url", "link").build());
        b.canonicalOverrides.put("name", CanonicalRecord.builder()
                .addAll(BASE, "name")
                .addAll(PASSIVE_VERB, "called").build());
        b.canonicalOverrides.put("description", CanonicalRecord.builder()
                .addAll(BASE, "description", "summary").build());
        b.canonicalOverrides.put("geo", CanonicalRecord.builder()
                .addAll(BASE, "location", "address")
                .addAll(PASSIVE_VERB, "in #", "around #", "at #", "on #").build());
        b.canonicalOverrides.put("streetAddress", CanonicalRecord.builder()
                .addAll(BASE, "street").build());
        b.canonicalOverrides.put("addressCountry", CanonicalRecord.builder()
                .addAll(PASSIVE_VERB, "in #")
                .addAll(BASE, "country").build());
        b.canonicalOverrides.put("addressRegion", CanonicalRecord.builder()
                .addAll(PASSIVE_VERB, "in #")
                .addAll(BASE, "state").build());
        b.canonicalOverrides.put("addressLocality", CanonicalRecord.builder()
                .addAll(BASE, "city").build());

        // restaurants
        b.manualCanonicalOverrides.put("datePublished", CanonicalRecord.builder()
                .addAll(PASSIVE_VERB, "published on #", "written on #")
                .addAll(BASE, "date published").build());
        b.manualCanonicalOverrides.put("ratingValue", CanonicalRecord.builder()
                .addAll(PASSIVE_VERB, "rated # star")
                .addAll(BASE, "rating").build());
        b.manualCanonicalOverrides.put("reviewRating", CanonicalRecord.builder()
                .addAll(BASE, "rating").build());
        b.manualCanonicalOverrides.put("telephone", CanonicalRecord.builder()
                .addAll(BASE, "telephone", "phone number").build());
        b.manualCanonicalOverrides.put("servesCuisine", CanonicalRecord.builder()
                .addAll(ADJECTIVE, "#")
                .addAll(VERB, "serves # cuisine", "serves # food", "offer # cuisine", "offer # food",
                        "serves", "offers")
                .addAll(PROPERTY, "# cuisine", "# food")
                .addAll(BASE, "cuisine", "food type").build());

        // hotels
        b.manualCanonicalOverrides.put("amenityFeature", CanonicalRecord.builder()
                .addAll(BASE, "amenity", "amenity feature")
                .addAll(VERB, "offers #", "offer #", "has #", "have #").build());
        b.manualCanonicalOverrides.put("checkinTime", CanonicalRecord.builder()
                .addAll(BASE, "checkin time", "check in time", "check-in time").build());
        b.manualCanonicalOverrides.put("checkoutTime", CanonicalRecord.builder()
                .addAll(BASE, "checkout time", "check out time", "check-out time").build());

        // people
        b.manualCanonicalOverrides.put("alumniOf", CanonicalRecord.builder()
                .addAll(BASE, "college degrees", "universities", "alma maters")
                .addAll(REVERSE_PROPERTY, "alumni of #", "alumnus of #", "alumna of #",
                        "# alumnus", "# alumni", "# grad", "# graduate")
                .addAll(VERB, "went to #", "graduated from #", "attended #", "studied at #")
                .addAll(PASSIVE_VERB, "educated at #", "graduated from #").build());
        b.manualCanonicalOverrides.put("award", CanonicalRecord.builder()
                .addAll(BASE, "awards")
                .addAll(REVERSE_PROPERTY, "winner of #", "recipient of #",
                        "# winner", "# awardee", "# recipient", "# holder")
                .addAll(VERB, "has the award #", "has received the # award", "won the award for #",
                        "won the # award", "received the # award", "received the #", "won the #", "won #",
                        "holds the award for #", "holds the # award").build());
        b.manualCanonicalOverrides.put("affiliation", CanonicalRecord.builder()
                .addAll(BASE, "affiliations")
                .addAll(REVERSE_PROPERTY, "member of #")
                .addAll(PASSIVE_VERB, "affiliated with #", "affiliated to #").build());
        b.manualCanonicalOverrides.put("worksFor", CanonicalRecord.builder()
                .addAll(BASE, "employers")
                .addAll(REVERSE_PROPERTY, "employee of #", "# employee")
                .addAll(VERB, "works for #", "works at #", "worked at #", "worked for #")
                .addAll(PASSIVE_VERB, "employed at #", "employed by #").build());

        // recipes
        b.manualCanonicalOverrides.put("author", CanonicalRecord.builder()
                .addAll(BASE, "author", "creator")
                .addAll(PASSIVE_VERB, "by", "made by", "written by", "created by", "authored by",
                        "uploaded by", "submitted by").build());
        b.manualCanonicalOverrides.put("publisher", CanonicalRecord.builder()
                .addAll(BASE, "publisher")
                .addAll(PASSIVE_VERB, "by", "made by", "published by").build());
        b.manualCanonicalOverrides.put("prepTime", CanonicalRecord.builder()
                .addAll(VERB, "takes # to prepare", "needs # to prepare")
                .addAll(BASE, "prep time", "preparation time", "time to prep", "time to prepare").build());
        b.manualCanonicalOverrides.put("cookTime", CanonicalRecord.builder()
                .addAll(VERB, "takes # to cook", "needs # to cook")
                .addAll(BASE, "cook time", "cooking time", "time to cook").build());
        b.manualCanonicalOverrides.put("totalTime", CanonicalRecord.builder()
                .addAll(VERB, "takes #", "requires #", "needs #", "uses #", "consumes #")
                .addAll(BASE, "total time", "time in total", "time to make").build());
        b.manualCanonicalOverrides.put("recipeYield", CanonicalRecord.builder()
                .addAll(VERB, "yields #", "feeds #", "produces #", "results in #", "is good for #")
                .addAll(PASSIVE_VERB, "yielding #")
                .addAll(BASE, "yield amount", "yield size").build());
        b.manualCanonicalOverrides.put("recipeCategory", CanonicalRecord.builder()
                .addAll(BASE, "categories").build());
        b.manualCanonicalOverrides.put("recipeIngredient", CanonicalRecord.builder()
                .addAll(VERB, "contains", "uses", "has")
                .addAll(PASSIVE_VERB, "containing", "using")
                .addAll(BASE, "ingredients").build());
        b.manualCanonicalOverrides.put("recipeInstructions", CanonicalRecord.builder()
                .addAll(BASE, "instructions").build());
        b.manualCanonicalOverrides.put("recipeCuisine", CanonicalRecord.builder()
                .addAll(ADJECTIVE, "#")
                .addAll(VERB, "belongs to the # cuisine")
                .addAll(BASE, "cuisines", "cuisine").build());
        b.manualCanonicalOverrides.put("reviewBody", CanonicalRecord.builder()
                .addAll(BASE, "body", "text", "content").build());
        b.manualCanonicalOverrides.put("saturatedFatContent", CanonicalRecord.builder()
                .addAll(BASE, "saturated fat content", "saturated fat amount", "saturated fat", "trans fat")
                .build());

        // products
        b.manualCanonicalOverrides.put("mpn", CanonicalRecord.builder()
                .addAll(BASE, "manufacturer part number").build());

        b.noFilterProperties.addAll(List.of("name", "priceRange", "gtin13", "productID", "mpn"));

        // handled by geo
        b.dropWithGeoProperties.addAll(List.of("streetAddress", "addressLocality"));

        b.structIncludeRootProperties.add("LocationFeatureSpecification");

        b.stringValueOverrides.put("org.schema:Restaurant_name", "com.yelp:restaurant_names");
        b.stringValueOverrides.put("org.schema:Person_name", "tt:person_full_name");
        b.stringValueOverrides.put("org.schema:Person_alumniOf", "tt:university_names");
        b.stringValueOverrides.put("org.schema:Person_worksFor", "tt:company_name");
        b.stringValueOverrides.put("org.schema:Hotel_name", "tt:hotel_name");

        return b.build();
    }

    public static final class Builder {
        private final Set<String> blockedClasses = new LinkedHashSet<>();
        private final Set<String> blockedProperties = new LinkedHashSet<>();
        private final List<String> structRoots = new ArrayList<>();
        private final Set<String> nonStructTypes = new LinkedHashSet<>();
        private final Set<String> forceArrayProperties = new LinkedHashSet<>();
        private final Set<String> forceNotArrayProperties = new LinkedHashSet<>();
        private final Map<String, SemanticType> propertyTypeOverrides = new LinkedHashMap<>();
        private final Map<String, CanonicalRecord> canonicalOverrides = new LinkedHashMap<>();
        private final Map<String, CanonicalRecord> manualCanonicalOverrides = new LinkedHashMap<>();
        private final Set<String> noFilterProperties = new LinkedHashSet<>();
        private final Set<String> dropWithGeoProperties = new LinkedHashSet<>();
        private final Set<String> structIncludeRootProperties = new LinkedHashSet<>();
        private final Map<String, String> stringValueOverrides = new LinkedHashMap<>();
        private final Set<String> reservedWords = new LinkedHashSet<>();
        private final Map<String, SemanticType> builtinTypes = new LinkedHashMap<>();
        private final List<String> collectionSuffixes = new ArrayList<>(List.of("List", "Collection", "Section", "Catalog"));
        private String rootType = "Thing";
        private String actionRoot = "Action";
        private String enumerationRoot = "Enumeration";
        private String collectionRoot = "ItemList";
        private String textType = "Text";
        private String ambiguousNumericType = "QuantitativeValue";
        private String classPrefix = "org.schema:";
        private boolean manual;
        private boolean alwaysBaseCanonical = true;

        private Builder() {
        }

        public Builder blockedClasses(Set<String> values) {
            replace(blockedClasses, values);
            return this;
        }

        public Builder blockedProperties(Set<String> values) {
            replace(blockedProperties, values);
            return this;
        }

        public Builder structRoots(List<String> values) {
            structRoots.clear();
            structRoots.addAll(values);
            return this;
        }

        public Builder nonStructTypes(Set<String> values) {
            replace(nonStructTypes, values);
            return this;
        }

        public Builder forceArrayProperties(Set<String> values) {
            replace(forceArrayProperties, values);
            return this;
        }

        public Builder forceNotArrayProperties(Set<String> values) {
            replace(forceNotArrayProperties, values);
            return this;
        }

        public Builder propertyTypeOverride(String property, SemanticType type) {
            propertyTypeOverrides.put(property, type);
            return this;
        }

        public Builder canonicalOverride(String property, CanonicalRecord canonical) {
            canonicalOverrides.put(property, canonical);
            return this;
        }

        public Builder manualCanonicalOverride(String property, CanonicalRecord canonical) {
            manualCanonicalOverrides.put(property, canonical);
            return this;
        }

        public Builder noFilterProperties(Set<String> values) {
            replace(noFilterProperties, values);
            return this;
        }

        public Builder dropWithGeoProperties(Set<String> values) {
            replace(dropWithGeoProperties, values);
            return this;
        }

        public Builder structIncludeRootProperties(Set<String> values) {
            replace(structIncludeRootProperties, values);
            return this;
        }

        public Builder stringValueOverride(String fileId, String dataset) {
            stringValueOverrides.put(fileId, dataset);
            return this;
        }

        public Builder reservedWords(Set<String> values) {
            replace(reservedWords, values);
            return this;
        }

        public Builder builtinType(String typeName, SemanticType type) {
            builtinTypes.put(typeName, type);
            return this;
        }

        public Builder collectionSuffixes(List<String> values) {
            collectionSuffixes.clear();
            collectionSuffixes.addAll(values);
            return this;
        }

        public Builder rootType(String value) {
            this.rootType = value;
            return this;
        }

        public Builder actionRoot(String value) {
            this.actionRoot = value;
            return this;
        }

        public Builder enumerationRoot(String value) {
            this.enumerationRoot = value;
            return this;
        }

        public Builder collectionRoot(String value) {
            this.collectionRoot = value;
            return this;
        }

        public Builder textType(String value) {
            this.textType = value;
            return this;
        }

        public Builder ambiguousNumericType(String value) {
            this.ambiguousNumericType = value;
            return this;
        }

        public Builder classPrefix(String value) {
            this.classPrefix = value;
            return this;
        }

        public Builder manual(boolean value) {
            this.manual = value;
            return this;
        }

        public Builder alwaysBaseCanonical(boolean value) {
            this.alwaysBaseCanonical = value;
            return this;
        }

        public ResolverConfig build() {
            return new ResolverConfig(this);
        }

        private static void replace(Set<String> target, Set<String> values) {
            target.clear();
            target.addAll(values);
        }
    }
}
