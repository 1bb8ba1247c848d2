package com.dcruver.ideatree.classify;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword tables and phrase patterns for one note language.
 *
 * Map-valued tables are ordered and scanned front to back, so the first entry that
 * matches wins. Time patterns capture hour, minute and meridiem in groups 1 to 3 and
 * are tried in list order.
 */
@Value
@Builder
public class LanguageRules {

    private static final int FLAGS =
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    String language;
    Locale locale;

    // Categories
    List<String> mandatoryCategories;
    Map<String, List<String>> categoryKeywords;
    String routineCategory;
    Map<String, String> routineActivities;
    List<String> deleteKeywords;

    // Idea distillation
    Pattern leadingFiller;
    Set<String> stopWords;
    List<String> creationKeywords;
    Set<String> structuralNouns;
    Pattern commandVerb;

    // Enumerations
    Pattern conjunction;

    // Reminders
    Pattern reminderTrigger;
    Pattern dayAfterTomorrow;
    Pattern tomorrow;
    Pattern today;
    Map<String, DayOfWeek> weekdays;
    String weekdayPrefix;
    List<Pattern> timePatterns;
    Pattern relativeOffset;
    Pattern pmMarker;
    Pattern messageLeadingFiller;
    Pattern messageTrailingFiller;

    // Reasons
    String unclassifiableReason;
    String emptyResponseReason;
    String missingGroupReason;

    public boolean isMandatoryCategory(String group) {
        return group != null && mandatoryCategories.contains(group.strip().toLowerCase(locale));
    }

    public Pattern weekdayPattern() {
        String names = String.join("|", weekdays.keySet());
        return pattern("\\b" + weekdayPrefix + "(" + names + ")\\b");
    }

    public static LanguageRules forLanguage(String language) {
        if (language != null && language.toLowerCase(Locale.ROOT).startsWith("en")) {
            return english();
        }
        return spanish();
    }

    static Pattern pattern(String regex) {
        return Pattern.compile(regex, FLAGS);
    }

    public static LanguageRules spanish() {
        return LanguageRules.builder()
            .language("es")
            .locale(new Locale("es"))
            .mandatoryCategories(List.of(
                "rutina diaria", "compras", "trabajo/clase", "finanzas",
                "viajes", "vida social", "citas"))
            .categoryKeywords(ordered(
                "rutina diaria", List.of("dormir", "despertar", "levantarme", "levantarse", "acostarme",
                    "acostarse", "desayunar", "desayuno", "almorzar", "almuerzo",
                    "comer a las", "merendar", "merienda", "cenar", "cena",
                    "ducharme", "ducharse", "meditar", "rutina", "hábito", "horario de",
                    "hacer deporte", "deporte", "nadar", "natación", "natacion",
                    "correr", "running", "yoga", "ciclismo", "bici ", "bicicleta",
                    "entrenar", "entrenamiento", "pilates", "boxeo", "gimnasio", "gym"),
                "compras", List.of("comprar ", "necesito comprar", "tengo que comprar"),
                "trabajo/clase", List.of("examen", "entrega", "trabajo de clase", "reunión de trabajo",
                    "presentación del trabajo"),
                "finanzas", List.of("pagar el recibo", "pagar la factura", "pagar impuesto",
                    "recibo de", "factura de", "mi sueldo", "mis ahorros"),
                "viajes", List.of("viaje a ", "viajar a ", "vuelo a ", "reservar hotel",
                    "billete de avión", "de vacaciones"),
                "vida social", List.of("quedar con ", "quedada con ", "cena con ", "comida con ",
                    "fiesta de ", "cumpleaños de "),
                "citas", List.of("cita con el ", "cita médica", "cita con mi ", "ir al dentista",
                    "ir al médico", "cita con el dentista", "cita con el médico")))
            .routineCategory("rutina diaria")
            .routineActivities(orderedStrings(
                "dormir", "dormir",
                "acostarme", "dormir",
                "acostarse", "dormir",
                "levantarme", "levantarse",
                "levantarse", "levantarse",
                "despertar", "levantarse",
                "despertarme", "levantarse",
                "desayunar", "desayuno",
                "desayuno", "desayuno",
                "almorzar", "almuerzo",
                "almuerzo", "almuerzo",
                "comer", "comer",
                "merendar", "merienda",
                "merienda", "merienda",
                "cenar", "cena",
                "cena", "cena",
                "ducharme", "ducha",
                "ducharse", "ducha",
                "ducha", "ducha",
                "meditar", "meditación",
                "meditación", "meditación",
                "deporte", "deporte",
                "hacer deporte", "deporte",
                "nadar", "deporte",
                "natación", "deporte",
                "natacion", "deporte",
                "correr", "deporte",
                "running", "deporte",
                "yoga", "deporte",
                "ciclismo", "deporte",
                "bicicleta", "deporte",
                "pilates", "deporte",
                "boxeo", "deporte",
                "ejercicio", "deporte",
                "entrenar", "deporte",
                "entrenamiento", "deporte",
                "gimnasio", "deporte",
                "gym", "deporte",
                "estudiar", "estudio"))
            .deleteKeywords(List.of(
                "elimina ", "eliminar ", "elimina la", "eliminar la",
                "borra ", "borrar ", "borra la", "borrar la",
                "quita ", "quitar ", "quita la", "quitar la",
                "ya no quiero", "descarta ", "descartar ",
                "bórralo", "bórrala", "elimínalo", "elimínala",
                "ya no necesito", "tacha ", "tachar "))
            .leadingFiller(pattern(
                "^(me\\s+gustar[ií]a\\s+(que\\s+)?|quisiera\\s+|quiero\\s+que\\s+|quiero\\s+|tengo\\s+que\\s+|"
                    + "tengo\\s+ganas\\s+de\\s+|voy\\s+a\\s+|me\\s+apetece\\s+|"
                    + "tendr[ií]a\\s+que\\s+|deber[ií]a\\s+|me\\s+conviene\\s+|necesito\\s+|necesitar[ií]a\\s+|"
                    + "pienso\\s+en\\s+|estoy\\s+pensando\\s+en\\s+|pienso\\s+|me\\s+interesar[ií]a\\s+|"
                    + "me\\s+mola\\s+|me\\s+apetecer[ií]a\\s+|planifico\\s+|planeo\\s+|plan\\s+de\\s+)"))
            .stopWords(Set.of(
                "el", "la", "los", "las", "un", "una", "unos", "unas",
                "de", "del", "al", "que", "en", "y", "a", "o", "con",
                "por", "para", "me", "te", "se", "le", "lo", "su",
                "si", "ya", "no", "como", "pero", "este", "esta",
                "ese", "esa", "aquel", "mi", "tu", "nos", "les"))
            .creationKeywords(List.of(
                "añade", "añadir", "agrega", "agregar", "crea", "crear",
                "abre", "abrir", "nuevo grupo", "nueva categoria",
                "nueva categoría", "el grupo", "un grupo",
                "el subgrupo", "un subgrupo", "nuevo subgrupo", "nueva sección",
                "nueva seccion", "subgrupo de"))
            .structuralNouns(Set.of("subgrupo", "grupo", "categoría", "categoria", "seccion", "sección"))
            .commandVerb(pattern("^(a[ñn]ade|agrega|crea|abre|a[ñn]adir|agregar|crear|abrir|pon|poner|mete|meter)\\b"))
            .conjunction(pattern("\\s*,?\\s+(?:y|e)\\s+"))
            .reminderTrigger(pattern(
                "\\b(?:recu[eé]rdame|recordarme|av[ií]same|notif[ií]came|al[eé]rtame"
                    + "|pon(?:me)?\\s+(?:una?\\s+)?(?:alarma|alerta|recordatorio)"
                    + "|crea(?:me)?\\s+(?:una?\\s+)?(?:alarma|recordatorio))\\b"))
            .dayAfterTomorrow(pattern("\\bpasado\\s+mañana\\b"))
            .tomorrow(pattern("(?<!\\bla\\s)\\bmañana\\b"))
            .today(pattern("\\b(?:hoy|esta\\s+noche|esta\\s+tarde)\\b"))
            .weekdays(orderedDays(
                "lunes", DayOfWeek.MONDAY,
                "martes", DayOfWeek.TUESDAY,
                "miércoles", DayOfWeek.WEDNESDAY,
                "miercoles", DayOfWeek.WEDNESDAY,
                "jueves", DayOfWeek.THURSDAY,
                "viernes", DayOfWeek.FRIDAY,
                "sábado", DayOfWeek.SATURDAY,
                "sabado", DayOfWeek.SATURDAY,
                "domingo", DayOfWeek.SUNDAY))
            .weekdayPrefix("(?:(?:el|este|pr[oó]ximo)\\s+)*")
            .timePatterns(List.of(pattern(
                "\\ba\\s+las?\\s+(\\d{1,2})(?:[:.](\\d{2}))?(?!\\d)"
                    + "(?:\\s*(de\\s+la\\s+(?:tarde|noche|mañana)|[ap]\\.?m\\b\\.?|h\\b|horas\\b))?"),
                pattern(
                "\\b(\\d{1,2}):(\\d{2})(?!\\d)(?:\\s*(de\\s+la\\s+(?:tarde|noche|mañana)|[ap]\\.?m\\b\\.?|h\\b))?"),
                // bare hour right after a day word: "mañana 9"
                pattern(
                "(?<=\\b(?:mañana|hoy|lunes|martes|miércoles|miercoles|jueves|viernes|sábado|sabado|domingo)\\s)"
                    + "(\\d{1,2})(?:[:.](\\d{2}))?(?!\\d)"
                    + "(?!\\s*(?:minutos?|mins?|horas?|d[ií]as?|semanas?)\\b)"
                    + "(?:\\s*(de\\s+la\\s+(?:tarde|noche|mañana)|[ap]\\.?m\\b\\.?|h\\b))?")))
            .relativeOffset(pattern("\\b(?:en|dentro\\s+de)\\s+(\\d{1,3})\\s*(minutos?|mins?|horas?|h)\\b"))
            .pmMarker(pattern("^(?:p|de\\s+la\\s+(?:tarde|noche))"))
            .messageLeadingFiller(pattern("^(?:(?:que|de|para|a|sobre|por\\s+favor|y)\\b[\\s,.:;-]*)+"))
            .messageTrailingFiller(pattern("(?:[\\s,.:;-]*\\b(?:por\\s+favor|gracias|y|a)\\b)+[\\s,.!:;-]*$"))
            .unclassifiableReason("La nota no expresa una idea clasificable.")
            .emptyResponseReason("Respuesta vacía del modelo.")
            .missingGroupReason("No se pudo determinar el grupo de la nota.")
            .build();
    }

    public static LanguageRules english() {
        return LanguageRules.builder()
            .language("en")
            .locale(Locale.ENGLISH)
            .mandatoryCategories(List.of(
                "daily routine", "shopping", "work/class", "finance",
                "travel", "social life", "appointments"))
            .categoryKeywords(ordered(
                "daily routine", List.of("sleep", "wake up", "get up", "go to bed", "breakfast",
                    "lunch at", "dinner at", "shower", "meditate", "routine", "habit",
                    "workout", "exercise", "swim", "running", "go for a run", "yoga", "cycling",
                    "bike ride", "pilates", "boxing", "gym"),
                "shopping", List.of("buy ", "need to buy", "have to buy", "groceries"),
                "work/class", List.of("exam", "deadline", "homework", "work meeting", "presentation for"),
                "finance", List.of("pay the bill", "pay the invoice", "pay taxes", "electricity bill",
                    "my salary", "my savings"),
                "travel", List.of("trip to ", "travel to ", "flight to ", "book a hotel", "plane ticket",
                    "on vacation"),
                "social life", List.of("meet up with ", "hang out with ", "dinner with ", "lunch with ",
                    "party at ", "birthday party"),
                "appointments", List.of("appointment with ", "doctor's appointment", "go to the dentist",
                    "go to the doctor", "dentist appointment")))
            .routineCategory("daily routine")
            .routineActivities(orderedStrings(
                "sleep", "sleep",
                "go to bed", "sleep",
                "wake up", "wake up",
                "get up", "wake up",
                "breakfast", "breakfast",
                "lunch", "lunch",
                "dinner", "dinner",
                "shower", "shower",
                "meditate", "meditation",
                "meditation", "meditation",
                "workout", "sport",
                "exercise", "sport",
                "swim", "sport",
                "running", "sport",
                "run", "sport",
                "yoga", "sport",
                "cycling", "sport",
                "bike", "sport",
                "pilates", "sport",
                "boxing", "sport",
                "gym", "sport",
                "training", "sport",
                "study", "study"))
            .deleteKeywords(List.of(
                "delete ", "remove ", "erase ", "get rid of", "cross off", "cross out",
                "no longer want", "don't want", "no longer need", "discard ", "scratch "))
            .leadingFiller(pattern(
                "^(i\\s+would\\s+like\\s+(to\\s+)?|i'd\\s+like\\s+(to\\s+)?|i\\s+want\\s+(to\\s+)?|"
                    + "i\\s+have\\s+to\\s+|i\\s+need\\s+(to\\s+)?|i'm\\s+going\\s+to\\s+|i\\s+am\\s+going\\s+to\\s+|"
                    + "i\\s+should\\s+|i\\s+must\\s+|i'm\\s+thinking\\s+(of|about)\\s+|i\\s+plan\\s+to\\s+|"
                    + "planning\\s+to\\s+|want\\s+to\\s+|need\\s+to\\s+|have\\s+to\\s+)"))
            .stopWords(Set.of(
                "the", "a", "an", "of", "to", "in", "on", "at", "for", "with",
                "and", "or", "my", "your", "i", "me", "it", "is", "be", "that",
                "this", "by", "from", "some", "as", "but", "not", "no", "so"))
            .creationKeywords(List.of(
                "add", "create", "open", "new group", "new category", "the group", "a group",
                "the subgroup", "a subgroup", "new subgroup", "new section", "subgroup of"))
            .structuralNouns(Set.of("subgroup", "group", "category", "section"))
            .commandVerb(pattern("^(add|create|open|put|insert|make)\\b"))
            .conjunction(pattern("\\s*,?\\s+(?:and|&)\\s+"))
            .reminderTrigger(pattern(
                "\\b(?:remind\\s+me|notify\\s+me|alert\\s+me"
                    + "|set\\s+(?:me\\s+)?(?:an?\\s+)?(?:alert|alarm|reminder))\\b"))
            .dayAfterTomorrow(pattern("\\b(?:the\\s+)?day\\s+after\\s+tomorrow\\b"))
            .tomorrow(pattern("\\btomorrow\\b"))
            .today(pattern("\\b(?:today|tonight|this\\s+evening)\\b"))
            .weekdays(orderedDays(
                "monday", DayOfWeek.MONDAY,
                "tuesday", DayOfWeek.TUESDAY,
                "wednesday", DayOfWeek.WEDNESDAY,
                "thursday", DayOfWeek.THURSDAY,
                "friday", DayOfWeek.FRIDAY,
                "saturday", DayOfWeek.SATURDAY,
                "sunday", DayOfWeek.SUNDAY))
            .weekdayPrefix("(?:(?:on|next|this)\\s+)*")
            .timePatterns(List.of(pattern(
                "\\bat\\s+(\\d{1,2})(?::(\\d{2}))?(?!\\d)(?:\\s*([ap]\\.?m\\b\\.?|o'?clock\\b))?"),
                pattern("\\b(\\d{1,2}):(\\d{2})(?!\\d)(?:\\s*([ap]\\.?m\\b\\.?))?"),
                pattern("\\b(\\d{1,2})()\\s*([ap]\\.?m\\b\\.?)"),
                // bare hour right after a day word: "tomorrow 9"
                pattern(
                "(?<=\\b(?:tomorrow|today|tonight|monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\s)"
                    + "(\\d{1,2})(?::(\\d{2}))?(?!\\d)"
                    + "(?!\\s*(?:minutes?|mins?|hours?|hrs?|days?|weeks?)\\b)"
                    + "(?:\\s*([ap]\\.?m\\b\\.?|o'?clock\\b))?")))
            .relativeOffset(pattern("\\bin\\s+(\\d{1,3})\\s*(minutes?|mins?|hours?|hrs?|h)\\b"))
            .pmMarker(pattern("^p"))
            .messageLeadingFiller(pattern("^(?:(?:to|that|about|for|of|please|and)\\b[\\s,.:;-]*)+"))
            .messageTrailingFiller(pattern("(?:[\\s,.:;-]*\\b(?:please|thanks|and)\\b)+[\\s,.!:;-]*$"))
            .unclassifiableReason("The note does not express a classifiable idea.")
            .emptyResponseReason("The model returned an empty response.")
            .missingGroupReason("Could not determine a group for the note.")
            .build();
    }

    private static Map<String, List<String>> ordered(Object... pairs) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> keywords = (List<String>) pairs[i + 1];
            map.put((String) pairs[i], keywords);
        }
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, String> orderedStrings(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, DayOfWeek> orderedDays(Object... pairs) {
        Map<String, DayOfWeek> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (DayOfWeek) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
