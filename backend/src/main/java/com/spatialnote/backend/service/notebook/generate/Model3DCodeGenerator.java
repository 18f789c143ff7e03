package com.spatialnote.backend.service.notebook.generate;

import com.spatialnote.backend.domain.payload.Model3DData;
import com.spatialnote.backend.domain.payload.Model3DData.Vector3;

import java.util.stream.Collectors;

import static com.spatialnote.backend.service.notebook.generate.PyLiterals.comment;
import static com.spatialnote.backend.service.notebook.generate.PyLiterals.num;
import static com.spatialnote.backend.service.notebook.generate.PyLiterals.str;

public class Model3DCodeGenerator implements PayloadCodeGenerator<Model3DData> {

    static final String EMPTY = "# Empty 3D model\nprint('No 3D model data available')";

    @Override
    public String generate(Model3DData model) {
        if (model == null || model.isEmpty()) return EMPTY;

        String vertices = model.vertices().stream()
                .map(Model3DCodeGenerator::vec)
                .collect(Collectors.joining(",\n    "));
        String faces = model.faces().stream()
                .map(f -> "[" + f.vertices().stream().map(String::valueOf).collect(Collectors.joining(", ")) + "]")
                .collect(Collectors.joining(",\n    "));

        return "# " + comment(model.title()) + "\n"
                + "# Generated from 3D Model Viewer\n"
                + "# Model Type: " + comment(model.modelType()) + "\n"
                + "\n"
                + "import numpy as np\n"
                + "import matplotlib.pyplot as plt\n"
                + "from mpl_toolkits.mplot3d.art3d import Poly3DCollection\n"
                + "\n"
                + "# 3D Model data (" + model.vertices().size() + " vertices, " + model.faces().size() + " faces)\n"
                + "vertices = np.array([\n"
                + "    " + vertices + "\n"
                + "])\n"
                + "\n"
                + "faces = [\n"
                + (faces.isEmpty() ? "" : "    " + faces + "\n")
                + "]\n"
                + "\n"
                + "scale = " + num(model.scale()) + "\n"
                + "position = np.array(" + vec(model.position()) + ")\n"
                + "rotation = np.array(" + vec(model.rotation()) + ")\n"
                + "scaled_vertices = vertices * scale + position\n"
                + "\n"
                + "fig = plt.figure(figsize=(12, 10))\n"
                + "ax = fig.add_subplot(111, projection='3d')\n"
                + "mesh_faces = [scaled_vertices[face] for face in faces if len(face) >= 3]\n"
                + "ax.add_collection3d(Poly3DCollection(mesh_faces, alpha=0.7, facecolor='lightblue', edgecolor='black'))\n"
                + "ax.scatter(scaled_vertices[:, 0], scaled_vertices[:, 1], scaled_vertices[:, 2], c='red', s=20)\n"
                + "ax.set_title(" + str(model.title()) + ")\n"
                + "plt.tight_layout()\n"
                + "plt.show()\n"
                + "\n"
                + "print(f\"Vertices: {len(vertices)}, Faces: {len(faces)}\")";
    }

    private static String vec(Vector3 v) {
        return "[" + num(v.x()) + ", " + num(v.y()) + ", " + num(v.z()) + "]";
    }
}
