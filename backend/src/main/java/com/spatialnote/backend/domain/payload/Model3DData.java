package com.spatialnote.backend.domain.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Mesh payload: vertices plus faces indexing into them, with a uniform scale
 * and a translation applied on export.
 */
public record Model3DData(
        String title,
        String modelType,   // mesh | cube | sphere | ...
        List<Vector3> vertices,
        List<Face> faces,
        List<Material> materials,
        double scale,
        Vector3 position,
        Vector3 rotation
) {
    public Model3DData {
        title = title != null ? title : "3D Model";
        modelType = modelType != null ? modelType : "mesh";
        vertices = vertices != null ? List.copyOf(vertices) : List.of();
        faces = faces != null ? List.copyOf(faces) : List.of();
        materials = materials != null ? List.copyOf(materials) : List.of();
        if (scale == 0) scale = 1.0;
        position = position != null ? position : Vector3.ZERO;
        rotation = rotation != null ? rotation : Vector3.ZERO;
    }

    public record Vector3(double x, double y, double z) {
        public static final Vector3 ZERO = new Vector3(0, 0, 0);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Face(List<Integer> vertices, Integer materialIndex) {
        public Face {
            vertices = vertices != null ? List.copyOf(vertices) : List.of();
        }

        public Face(List<Integer> vertices) {
            this(vertices, null);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Material(String name, String color, Double metallic, Double roughness, Double transparency) {
        public Material(String name, String color) {
            this(name, color, null, null, null);
        }
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }
}
