package com.spatialnote.backend.service.notebook.generate;

import com.spatialnote.backend.domain.payload.PointCloudData;
import com.spatialnote.backend.domain.payload.PointCloudData.Point;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.spatialnote.backend.service.notebook.generate.PyLiterals.comment;
import static com.spatialnote.backend.service.notebook.generate.PyLiterals.num;
import static com.spatialnote.backend.service.notebook.generate.PyLiterals.str;

public class PointCloudCodeGenerator implements PayloadCodeGenerator<PointCloudData> {

    static final String EMPTY = "# Empty point cloud\nprint('No point cloud data available')";

    @Override
    public String generate(PointCloudData cloud) {
        if (cloud == null || cloud.isEmpty()) return EMPTY;

        boolean intensity = cloud.hasIntensity();
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(comment(cloud.title())).append('\n');
        sb.append("# Generated from Point Cloud Viewer\n");
        sb.append("# Demo Type: ").append(comment(cloud.demoType())).append('\n');
        sb.append('\n');
        sb.append("import numpy as np\n");
        sb.append("import matplotlib.pyplot as plt\n");
        sb.append("from mpl_toolkits.mplot3d import Axes3D\n");
        sb.append('\n');
        sb.append("# Point cloud data (").append(cloud.totalPoints()).append(" points)\n");
        sb.append("x_points = np.array([").append(join(cloud, 'x')).append("])\n");
        sb.append("y_points = np.array([").append(join(cloud, 'y')).append("])\n");
        sb.append("z_points = np.array([").append(join(cloud, 'z')).append("])\n");
        if (intensity) {
            sb.append("intensities = np.array([").append(join(cloud, 'i')).append("])\n");
        }
        if (!cloud.parameters().isEmpty()) {
            sb.append("\n# Parameters: ").append(parameters(cloud.parameters())).append('\n');
        }
        sb.append('\n');
        sb.append("fig = plt.figure(figsize=(12, 10))\n");
        sb.append("ax = fig.add_subplot(111, projection='3d')\n");
        if (intensity) {
            sb.append("scatter = ax.scatter(x_points, y_points, z_points, c=intensities, cmap='viridis', alpha=0.7)\n");
            sb.append("plt.colorbar(scatter)\n");
        } else {
            sb.append("scatter = ax.scatter(x_points, y_points, z_points, alpha=0.7)\n");
        }
        sb.append("ax.set_xlabel(").append(str(cloud.xAxisLabel())).append(")\n");
        sb.append("ax.set_ylabel(").append(str(cloud.yAxisLabel())).append(")\n");
        sb.append("ax.set_zlabel(").append(str(cloud.zAxisLabel())).append(")\n");
        sb.append("ax.set_title(").append(str(cloud.title())).append(")\n");
        sb.append("plt.tight_layout()\n");
        sb.append("plt.show()\n");
        sb.append('\n');
        sb.append("print(f\"Total Points: {len(x_points)}\")");
        return sb.toString();
    }

    private static String join(PointCloudData cloud, char axis) {
        return cloud.points().stream().map(p -> num(component(p, axis))).collect(Collectors.joining(", "));
    }

    private static double component(Point p, char axis) {
        return switch (axis) {
            case 'x' -> p.x();
            case 'y' -> p.y();
            case 'z' -> p.z();
            default -> p.intensity() == null ? 0.0 : p.intensity();
        };
    }

    private static String parameters(Map<String, Double> params) {
        return new TreeMap<>(params).entrySet().stream()
                .map(e -> comment(e.getKey()) + ": " + num(e.getValue()))
                .collect(Collectors.joining(", "));
    }
}
