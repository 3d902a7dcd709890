package com.linlay.analysisagent.sandbox;

import java.util.LinkedHashMap;
import java.util.Map;

public sealed interface ResultValue permits ResultValue.Scalar, ResultValue.Table, ResultValue.Opaque {

    String type();

    Map<String, Object> toMap();

    record Scalar(Object value) implements ResultValue {
        @Override
        public String type() {
            return "scalar";
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", type());
            map.put("value", value);
            return map;
        }
    }

    record Table(DataTable table) implements ResultValue {
        public Table {
            table = table == null ? DataTable.empty() : table;
        }

        @Override
        public String type() {
            return "table";
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", type());
            map.putAll(table.toMap());
            return map;
        }
    }

    record Opaque(String typeName, String repr) implements ResultValue {
        public Opaque {
            typeName = typeName == null ? "object" : typeName;
            repr = repr == null ? "" : repr;
        }

        @Override
        public String type() {
            return "opaque";
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", type());
            map.put("type_name", typeName);
            map.put("repr", repr);
            return map;
        }
    }
}
