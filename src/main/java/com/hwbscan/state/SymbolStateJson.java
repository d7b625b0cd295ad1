package com.hwbscan.state;

import com.hwbscan.model.Gap;
import com.hwbscan.model.GapStatus;
import com.hwbscan.model.QualityTier;
import com.hwbscan.model.Setup;
import com.hwbscan.model.SetupKind;
import com.hwbscan.model.SetupStatus;
import com.hwbscan.model.Signal;
import com.hwbscan.model.SymbolState;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.time.LocalDate;

/**
 * JSON codec for {@link SymbolState}.
 */
public final class SymbolStateJson {
    private SymbolStateJson() {
    }

    public static JSONObject toJson(SymbolState state) {
        JSONObject root = new JSONObject();
        root.put("symbol", state.getSymbol());
        root.put("last_updated", state.getLastUpdated() == null ? JSONObject.NULL : state.getLastUpdated().toString());
        root.put("last_analyzed_date", state.getLastAnalyzedDate() == null ? JSONObject.NULL : state.getLastAnalyzedDate().toString());

        JSONArray setups = new JSONArray();
        for (Setup setup : state.setups()) {
            JSONObject o = new JSONObject();
            o.put("id", setup.id);
            o.put("date", setup.date.toString());
            o.put("type", setup.kind.name());
            o.put("confidence", setup.confidence);
            o.put("zone_lower", setup.zoneLower);
            o.put("zone_upper", setup.zoneUpper);
            o.put("status", setup.status.label());
            setups.put(o);
        }
        root.put("setups", setups);

        JSONArray gaps = new JSONArray();
        for (Gap gap : state.gaps()) {
            JSONObject o = new JSONObject();
            o.put("id", gap.id);
            o.put("setup_id", gap.setupId);
            o.put("formation_date", gap.formationDate.toString());
            o.put("lower_bound", gap.lowerBound);
            o.put("upper_bound", gap.upperBound);
            o.put("gap_percentage", gap.gapPercentage);
            o.put("score", gap.score);
            o.put("quality", gap.quality.name());
            o.put("status", gap.status.label());
            o.put("violation_date", gap.violationDate == null ? JSONObject.NULL : gap.violationDate.toString());
            gaps.put(o);
        }
        root.put("fvgs", gaps);

        JSONArray signals = new JSONArray();
        for (Signal signal : state.signals()) {
            JSONObject o = new JSONObject();
            o.put("id", signal.id);
            o.put("setup_id", signal.setupId);
            o.put("fvg_id", signal.fvgId);
            o.put("breakout_date", signal.breakoutDate.toString());
            o.put("breakout_price", signal.breakoutPrice);
            o.put("resistance_price", signal.resistancePrice);
            o.put("score", signal.score);
            o.put("confidence", signal.confidence.name());
            o.put("breakout_percentage", signal.breakoutPercentage);
            signals.put(o);
        }
        root.put("signals", signals);
        return root;
    }

    /**
     * @throws org.json.JSONException or {@link IllegalArgumentException} on a malformed document
     */
    public static SymbolState fromJson(JSONObject root) {
        SymbolState state = new SymbolState(root.getString("symbol"));
        String lastUpdated = root.optString("last_updated", "");
        if (!lastUpdated.isEmpty() && !"null".equals(lastUpdated)) {
            state.setLastUpdated(Instant.parse(lastUpdated));
        }
        String lastAnalyzed = root.optString("last_analyzed_date", "");
        if (!lastAnalyzed.isEmpty() && !"null".equals(lastAnalyzed)) {
            state.setLastAnalyzedDate(LocalDate.parse(lastAnalyzed));
        }

        JSONArray setups = root.optJSONArray("setups");
        if (setups != null) {
            for (int i = 0; i < setups.length(); i++) {
                JSONObject o = setups.getJSONObject(i);
                state.addSetup(new Setup(
                        o.getString("id"),
                        LocalDate.parse(o.getString("date")),
                        SetupKind.fromLabel(o.getString("type")),
                        o.getDouble("confidence"),
                        o.optDouble("zone_lower", 0.0),
                        o.optDouble("zone_upper", 0.0),
                        SetupStatus.fromLabel(o.getString("status"))
                ));
            }
        }

        JSONArray gaps = root.optJSONArray("fvgs");
        if (gaps != null) {
            for (int i = 0; i < gaps.length(); i++) {
                JSONObject o = gaps.getJSONObject(i);
                String violation = o.optString("violation_date", "");
                state.addGap(new Gap(
                        o.getString("id"),
                        o.getString("setup_id"),
                        LocalDate.parse(o.getString("formation_date")),
                        o.getDouble("lower_bound"),
                        o.getDouble("upper_bound"),
                        o.optDouble("gap_percentage", 0.0),
                        o.getInt("score"),
                        QualityTier.fromLabel(o.optString("quality", "")),
                        GapStatus.fromLabel(o.getString("status")),
                        violation.isEmpty() || "null".equals(violation) ? null : LocalDate.parse(violation)
                ));
            }
        }

        JSONArray signals = root.optJSONArray("signals");
        if (signals != null) {
            for (int i = 0; i < signals.length(); i++) {
                JSONObject o = signals.getJSONObject(i);
                state.addSignal(new Signal(
                        o.getString("id"),
                        o.getString("setup_id"),
                        o.getString("fvg_id"),
                        LocalDate.parse(o.getString("breakout_date")),
                        o.getDouble("breakout_price"),
                        o.getDouble("resistance_price"),
                        o.getInt("score"),
                        QualityTier.fromLabel(o.optString("confidence", "")),
                        o.optDouble("breakout_percentage", 0.0)
                ));
            }
        }
        return state;
    }
}
