package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.payload.Model3DData;
import com.spatialnote.backend.domain.payload.Model3DData.Face;
import com.spatialnote.backend.domain.payload.Model3DData.Vector3;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Model3DExtractor extends RegexPayloadExtractor<Model3DData> {

    private static final Pattern FACES = Pattern.compile("faces\\s*=\\s*(?=\\[)");

    public Model3DExtractor() {
        super(List.of(
                Rule.of("vertices\\s*=\\s*(?:np\\.array\\()?(?=\\[)", (m, src) -> build(m.end(), src))
        ));
    }

    @Override
    protected void attach(Model3DData payload, WindowState target) {
        target.setModel3DData(payload);
    }

    private static Model3DData build(int listStart, String source) {
        List<Vector3> vertices = new ArrayList<>();
        String body = SourceText.bracketed(source, listStart).orElse("");
        for (String triple : SourceText.innerLists(body)) {
            vector(triple).ifPresent(vertices::add);
        }
        if (vertices.isEmpty()) return null;

        List<Face> faces = new ArrayList<>();
        Matcher f = FACES.matcher(source);
        if (f.find()) {
            String facesBody = SourceText.bracketed(source, f.end()).orElse("");
            for (String face : SourceText.innerLists(facesBody)) {
                List<Integer> idx = new ArrayList<>();
                for (Double d : SourceText.numbers(face)) idx.add(d.intValue());
                if (!idx.isEmpty()) faces.add(new Face(idx));
            }
        }

        double scale = SourceText.group(source, "(?m)^scale\\s*=\\s*(\\S+)\\s*$")
                .map(SourceText::number).orElse(1.0);

        return new Model3DData(
                SourceText.title(source).orElse("Imported Model"),
                SourceText.group(source, "(?m)^# Model Type: (.+?)\\s*$").orElseGet(() -> modelType(source)),
                vertices,
                faces,
                List.of(),
                scale,
                SourceText.group(source, "position\\s*=\\s*np\\.array\\(\\[([^\\]]*)\\]\\)").flatMap(Model3DExtractor::vector).orElse(null),
                SourceText.group(source, "rotation\\s*=\\s*np\\.array\\(\\[([^\\]]*)\\]\\)").flatMap(Model3DExtractor::vector).orElse(null));
    }

    private static Optional<Vector3> vector(String triple) {
        List<Double> n = SourceText.numbers(triple);
        return n.size() >= 3 ? Optional.of(new Vector3(n.get(0), n.get(1), n.get(2))) : Optional.empty();
    }

    private static String modelType(String source) {
        String s = source.toLowerCase(Locale.ROOT);
        if (s.contains("sphere") || s.contains("ball")) return "sphere";
        if (s.contains("cube") || s.contains("box")) return "cube";
        return "mesh";
    }
}
