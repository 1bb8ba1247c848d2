package com.dcruver.ideatree.nlp;

import com.dcruver.ideatree.classify.LanguageRules;
import com.dcruver.ideatree.domain.IdeaTree;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * System and user prompts for note classification, in Spanish and English.
 */
@Component
@Slf4j
public class ClassificationPrompts {

    static final String TOOL_NAME = "classify_note";

    private static final String SYSTEM_ES = """
        Eres un asistente que organiza ideas en un árbol de dos niveles: grupo, subgrupo opcional e ideas.
        Destila cada nota al mínimo esquemático posible y responde SOLO con JSON.

        PASO 0 - ¿El usuario quiere ELIMINAR algo? ("elimina", "borra", "quita", "ya no quiero", "descarta"...)
          → {"action": "delete", "makes_sense": true, "group": "...", "subgroup": null o "...", "idea": "idea a borrar" o null}
          idea=null borra el subgrupo entero, o el grupo entero si subgroup también es null.
          Si no sabes qué borrar → {"makes_sense": false, "reason": "No encontré qué eliminar"}

        PASO 1 - Si la nota no expresa una idea, plan o tarea (texto aleatorio, saludos, preguntas a la IA)
          → {"makes_sense": false, "reason": "explicación breve"}

        PASO 2 - Usa una CATEGORÍA OBLIGATORIA si la nota encaja: %s.
          En "rutina diaria" el subgrupo es el ámbito (dormir, desayuno, deporte...). Toda actividad física va en "deporte".

        PASO 3 - La idea tiene entre 1 y 4 palabras y NUNCA copia la nota. Quita el verbo si el grupo ya lo implica.
          "quiero comprar zapatos en el centro" → group="compras", subgroup="tienda centro", idea="zapatos"
          "me gustaría crear una página web" → group="página web", idea=null

        PASO 4 - Usa subgrupo solo cuando la nota da un lugar, tienda, plataforma o contexto concreto.

        PASO 5 - idea=null cuando la nota solo pide crear un grupo o subgrupo, o describe una iniciativa propia.
          Si la nota lista varias cosas distintas, devuelve un ARRAY con un objeto por idea;
          is_new_group e is_new_subgroup solo pueden ser true en el primero.

        Formato de cada objeto:
        {"action": "add", "makes_sense": true, "group": "...", "subgroup": null, "idea": "...",
         "is_new_group": false, "is_new_subgroup": false, "inherit_parent_ideas": false,
         "rename_group": null}
        rename_group={"old_name": "...", "new_name": "..."} solo si creas un grupo nuevo que choca con uno existente.
        inherit_parent_ideas=true solo si el usuario pide que el subgrupo nuevo herede las ideas del grupo.
        """;

    private static final String SYSTEM_EN = """
        You organise ideas into a two-level tree: group, optional subgroup, and ideas.
        Distil every note to its bare minimum and answer ONLY with JSON.

        STEP 0 - Does the user want to DELETE something? ("delete", "remove", "no longer want", "cross off"...)
          → {"action": "delete", "makes_sense": true, "group": "...", "subgroup": null or "...", "idea": "idea to delete" or null}
          idea=null deletes the whole subgroup, or the whole group when subgroup is also null.
          If you cannot tell what to delete → {"makes_sense": false, "reason": "Nothing to delete found"}

        STEP 1 - If the note is not an idea, plan or task (random text, greetings, questions to the AI)
          → {"makes_sense": false, "reason": "short explanation"}

        STEP 2 - Use a MANDATORY CATEGORY when the note fits one: %s.
          In "daily routine" the subgroup is the area (sleep, breakfast, sport...). Every physical activity goes under "sport".

        STEP 3 - The idea has 1 to 4 words and NEVER copies the note. Drop the verb when the group implies it.
          "I want to buy shoes downtown" → group="shopping", subgroup="downtown store", idea="shoes"
          "I'd like to build a website" → group="website", idea=null

        STEP 4 - Use a subgroup only when the note names a concrete place, shop, platform or context.

        STEP 5 - idea=null when the note only asks to create a group or subgroup, or describes a venture of its own.
          If the note lists several distinct things, return an ARRAY with one object per idea;
          is_new_group and is_new_subgroup may only be true on the first one.

        Shape of each object:
        {"action": "add", "makes_sense": true, "group": "...", "subgroup": null, "idea": "...",
         "is_new_group": false, "is_new_subgroup": false, "inherit_parent_ideas": false,
         "rename_group": null}
        rename_group={"old_name": "...", "new_name": "..."} only when a new group clashes with an existing one.
        inherit_parent_ideas=true only when the user asks the new subgroup to inherit the group's ideas.
        """;

    private static final List<String[]> EXAMPLES_ES = List.of(
        new String[]{"comprar pan en el super", "[]",
            "{\"action\":\"add\",\"makes_sense\":true,\"group\":\"compras\",\"subgroup\":\"super\",\"idea\":\"pan\",\"is_new_group\":true,\"is_new_subgroup\":true,\"inherit_parent_ideas\":false,\"rename_group\":null}"},
        new String[]{"quiero ver Alien y Terminator", "[{\"name\":\"películas\",\"ideas\":[],\"subgroups\":[]}]",
            "[{\"action\":\"add\",\"makes_sense\":true,\"group\":\"películas\",\"subgroup\":null,\"idea\":\"Alien\",\"is_new_group\":false,\"is_new_subgroup\":false,\"inherit_parent_ideas\":false,\"rename_group\":null},"
                + "{\"action\":\"add\",\"makes_sense\":true,\"group\":\"películas\",\"subgroup\":null,\"idea\":\"Terminator\",\"is_new_group\":false,\"is_new_subgroup\":false,\"inherit_parent_ideas\":false,\"rename_group\":null}]"},
        new String[]{"ya no quiero leche", "[{\"name\":\"compras\",\"ideas\":[\"leche\",\"pan\"],\"subgroups\":[]}]",
            "{\"action\":\"delete\",\"makes_sense\":true,\"group\":\"compras\",\"subgroup\":null,\"idea\":\"leche\"}"},
        new String[]{"asdfgh", "[]",
            "{\"makes_sense\":false,\"reason\":\"Texto sin significado\"}"}
    );

    private static final List<String[]> EXAMPLES_EN = List.of(
        new String[]{"buy bread at the supermarket", "[]",
            "{\"action\":\"add\",\"makes_sense\":true,\"group\":\"shopping\",\"subgroup\":\"supermarket\",\"idea\":\"bread\",\"is_new_group\":true,\"is_new_subgroup\":true,\"inherit_parent_ideas\":false,\"rename_group\":null}"},
        new String[]{"I want to watch Alien and Terminator", "[{\"name\":\"movies\",\"ideas\":[],\"subgroups\":[]}]",
            "[{\"action\":\"add\",\"makes_sense\":true,\"group\":\"movies\",\"subgroup\":null,\"idea\":\"Alien\",\"is_new_group\":false,\"is_new_subgroup\":false,\"inherit_parent_ideas\":false,\"rename_group\":null},"
                + "{\"action\":\"add\",\"makes_sense\":true,\"group\":\"movies\",\"subgroup\":null,\"idea\":\"Terminator\",\"is_new_group\":false,\"is_new_subgroup\":false,\"inherit_parent_ideas\":false,\"rename_group\":null}]"},
        new String[]{"I no longer want milk", "[{\"name\":\"shopping\",\"ideas\":[\"milk\",\"bread\"],\"subgroups\":[]}]",
            "{\"action\":\"delete\",\"makes_sense\":true,\"group\":\"shopping\",\"subgroup\":null,\"idea\":\"milk\"}"},
        new String[]{"asdfgh", "[]",
            "{\"makes_sense\":false,\"reason\":\"Meaningless text\"}"}
    );

    static final String TOOL_SCHEMA = """
        {
          "type": "object",
          "properties": {
            "action": {"type": "string", "enum": ["add", "delete", "remind"]},
            "makes_sense": {"type": "boolean"},
            "reason": {"type": "string"},
            "group": {"type": "string"},
            "subgroup": {"type": "string"},
            "idea": {"type": "string"},
            "is_new_group": {"type": "boolean"},
            "is_new_subgroup": {"type": "boolean"},
            "inherit_parent_ideas": {"type": "boolean"},
            "rename_group": {
              "type": "object",
              "properties": {
                "old_name": {"type": "string"},
                "new_name": {"type": "string"}
              }
            },
            "remind_at": {"type": "string", "description": "ISO-8601 local date-time"}
          },
          "required": ["action", "makes_sense"]
        }
        """;

    private final ObjectMapper objectMapper;

    public ClassificationPrompts() {
        this.objectMapper = new ObjectMapper();
    }

    public String system(LanguageRules rules) {
        String categories = rules.getMandatoryCategories().stream()
            .map(c -> "\"" + c + "\"")
            .collect(Collectors.joining(", "));
        return String.format(isEnglish(rules) ? SYSTEM_EN : SYSTEM_ES, categories);
    }

    public String user(String note, IdeaTree tree, LanguageRules rules) {
        boolean english = isEnglish(rules);
        StringBuilder prompt = new StringBuilder();
        for (String[] example : english ? EXAMPLES_EN : EXAMPLES_ES) {
            prompt.append(english ? "EXAMPLE:\nNote: \"" : "EJEMPLO:\nNota: \"").append(example[0]).append("\"\n");
            prompt.append(english ? "Existing groups: " : "Grupos existentes: ").append(example[1]).append('\n');
            prompt.append(english ? "Answer: " : "Respuesta: ").append(example[2]).append("\n\n");
        }

        prompt.append(english ? "NOW CLASSIFY:\nNote: \"" : "AHORA CLASIFICA:\nNota: \"").append(note).append("\"\n");
        prompt.append(english ? "Existing groups: " : "Grupos existentes: ").append(treeJson(tree)).append('\n');
        if (!tree.getGroups().isEmpty()) {
            String names = tree.groupNames().stream()
                .map(n -> "\"" + n + "\"")
                .collect(Collectors.joining(", "));
            prompt.append(english
                ? "Does the note talk about one of these groups (" + names + ") or a mandatory category? "
                    + "If not, use is_new_group=true with a new descriptive name.\n"
                : "¿La nota trata del mismo tema que alguno de estos grupos (" + names + ") o de una categoría obligatoria? "
                    + "Si no, usa is_new_group=true con un nombre descriptivo nuevo.\n");
        }
        prompt.append(english ? "Answer (JSON only):" : "Respuesta (solo JSON):");
        return prompt.toString();
    }

    public String toolDescription(LanguageRules rules) {
        return isEnglish(rules)
            ? "Record the classification of the note. Call once per distinct idea."
            : "Registra la clasificación de la nota. Llama una vez por cada idea distinta.";
    }

    String treeJson(IdeaTree tree) {
        try {
            return objectMapper.writeValueAsString(tree.getGroups());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize tree for prompt", e);
            return "[]";
        }
    }

    private static boolean isEnglish(LanguageRules rules) {
        return rules.getLocale().getLanguage().equals(Locale.ENGLISH.getLanguage());
    }
}
