package io.surfworks.graphlower.core.codecache;

import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import io.surfworks.graphlower.ir.ExternKernelNode;

/**
 * Writes extern kernel calls as a JSON document:
 * <pre>
 * {
 *   "nodes": [
 *     {"name": "buf0", "kernel": "extern_kernels.mm", "inputs": ["arg0", "arg1"], "args": []}
 *   ]
 * }
 * </pre>
 */
public final class GsonExternNodeSerializer implements ExternNodeSerializer {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @Override
    public String serialize(List<ExternKernelNode> nodes) {
        JsonArray array = new JsonArray();
        for (ExternKernelNode node : nodes) {
            JsonObject obj = new JsonObject();
            obj.addProperty("name", node.name());
            obj.addProperty("kernel", node.kernel());
            obj.add("inputs", GSON.toJsonTree(node.inputs()));
            obj.add("args", GSON.toJsonTree(node.args()));
            array.add(obj);
        }
        JsonObject root = new JsonObject();
        root.add("nodes", array);
        return GSON.toJson(root);
    }
}
