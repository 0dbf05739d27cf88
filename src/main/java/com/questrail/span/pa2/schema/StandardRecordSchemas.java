package com.questrail.span.pa2.schema;

import com.questrail.span.pa2.model.RecordTag;

import static com.questrail.span.pa2.field.FieldSpec.date;
import static com.questrail.span.pa2.field.FieldSpec.integer;
import static com.questrail.span.pa2.field.FieldSpec.risk;
import static com.questrail.span.pa2.field.FieldSpec.scaled;
import static com.questrail.span.pa2.field.FieldSpec.string;
import static com.questrail.span.pa2.field.FieldSpec.strings;
import static com.questrail.span.pa2.field.FieldSpec.tiers;
import static com.questrail.span.pa2.field.FieldSpec.time;

/**
 * StandardRecordSchemas
 * =============================================================================
 * The PA2 record layouts, one {@link RecordSchema} per tag.
 *
 * <p>Offsets are 0-based and end-exclusive and are reproduced exactly from the
 * PA2 file layout. A wrong offset does not fail; it silently shifts values,
 * so every change here needs a golden line in the tests.</p>
 *
 * <p>Scaled fields default to a scale of {@code 1e-6}. A negative scale marks
 * a field whose sign is the character immediately after the digits.</p>
 */
public final class StandardRecordSchemas
{
    private StandardRecordSchemas() {}

    /** {@code "0 "} exchange complex header, the first line of a file. */
    public static final RecordSchema EXCHANGE_COMPLEX_HEADER = RecordSchema.of(
            RecordTag.of("0 "), "ExchangeComplexHeader",
            string("clearing_organization", 2, 8),
            date("business_date", 8),
            string("settlement_or_intraday", 16, 17),
            string("file_identifier", 17, 19),
            time("business_time", 19),
            date("file_creation_date", 23),
            time("file_creation_time", 31),
            string("format_indicator", 35, 37),
            string("overall_limit_option", 37, 38),
            string("gross_net", 38, 39),
            string("filler", 39, 132));

    /** {@code "T "} currency conversion rate between two ISO currencies. */
    public static final RecordSchema CURRENCY_CONVERSION = RecordSchema.of(
            RecordTag.of("T "), "CurrencyConversion",
            string("from_iso", 2, 5),
            string("from_code", 5, 6),
            string("to_iso", 6, 9),
            string("to_code", 9, 10),
            scaled("rate", 10, 20));

    /** {@code "1 "} exchange header: acronym and numeric exchange code. */
    public static final RecordSchema EXCHANGE_HEADER = RecordSchema.of(
            RecordTag.of("1 "), "ExchangeHeader",
            string("acronym", 2, 5),
            string("code", 7, 9));

    /** {@code "2 "} first combined commodity line: currency, margin style and up to six member commodities. */
    public static final RecordSchema FIRST_COMBINED_COMMODITY = RecordSchema.of(
            RecordTag.of("2 "), "FirstCombinedCommodity",
            string("exchange", 2, 5),
            string("code", 6, 12),
            string("performance_bond_currency_iso", 13, 16),
            string("performance_bond_currency_code", 16, 17),
            string("option_margin_style", 17, 18), // P premium, F futures-style
            string("limit_option_value", 18, 19),
            string("combination_margin_method", 19, 20),
            string("commodity_1", 22, 32),
            string("contract_type_1", 32, 35),
            string("commodity_2", 38, 48),
            string("contract_type_2", 48, 51),
            string("commodity_3", 54, 64),
            string("contract_type_3", 64, 67),
            string("commodity_4", 70, 80),
            string("contract_type_4", 80, 83),
            string("commodity_5", 86, 96),
            string("contract_type_5", 96, 99),
            string("commodity_6", 102, 112),
            string("contract_type_6", 112, 115));

    /** {@code "3 "} second combined commodity line: intra-commodity spread tiers and initial-to-maintenance ratios. */
    public static final RecordSchema SECOND_COMBINED_COMMODITY = RecordSchema.of(
            RecordTag.of("3 "), "SecondCombinedCommodity",
            string("code", 2, 8),
            string("spread_charge_method", 8, 10),
            tiers("tiers", 10, 66),
            scaled("init_to_maint_member", 68, 72, 1e-3),
            scaled("init_to_maint_hedger", 72, 76, 1e-3),
            scaled("init_to_maint_speculator", 76, 80, 1e-3));

    /** {@code "C "} required intra-commodity spread, following a {@code "3 "} line. */
    public static final RecordSchema REQUIRED_SPREADS = RecordSchema.of(
            RecordTag.of("C "), "RequiredSpreads",
            string("commodity", 2, 8),
            integer("priority", 10, 12),
            integer("number_of_legs", 12, 14),
            scaled("charge_rate", 14, 21),
            strings("legs", 21, 77, 7));

    /** {@code "4 "} third combined commodity line: spot charges and short option minimum. */
    public static final RecordSchema THIRD_COMBINED_COMMODITY = RecordSchema.of(
            RecordTag.of("4 "), "ThirdCombinedCommodity",
            string("code", 2, 8),
            integer("spot_charge_method", 8, 10),
            integer("number_of_spot_contracts", 10, 12),
            integer("delivery_month_1", 12, 14),
            integer("delivery_month_1_contract", 14, 20),
            scaled("delivery_month_1_charge_spreads", 20, 27),
            scaled("delivery_month_1_charge_outrights", 27, 34),
            integer("delivery_month_2", 34, 36),
            integer("delivery_month_2_contract", 36, 42),
            scaled("delivery_month_2_charge_spreads", 42, 49),
            scaled("delivery_month_2_charge_outrights", 49, 56),
            scaled("short_option_minimum_charge_rate", 62, 69),
            scaled("adjustment_factor_members", 69, 72, 1e-2),
            scaled("adjustment_factor_hedgers", 72, 75, 1e-2),
            scaled("adjustment_factor_speculators", 75, 78, 1e-2),
            integer("short_option_minimum_calculation_method", 78, 79));

    /** {@code "B "} risk array calculation parameters for one contract, following a {@code "4 "} line. */
    public static final RecordSchema ARRAY_CALCULATION_PARAMETERS = RecordSchema.of(
            RecordTag.of("B "), "ArrayCalculationParameters",
            string("exchange", 2, 5),
            string("commodity", 5, 15),
            string("contract_type", 15, 18),
            integer("contract_month", 18, 24),
            string("contract_day", 24, 26),
            integer("option_month", 27, 33),
            string("option_day", 33, 35),
            scaled("base_volatility", 36, 44),
            scaled("volatility_scan_range", 44, 62, 1e-8),
            scaled("future_price_scan_range", 52, 57, 1e-3),
            scaled("extreme_move_multiplier", 57, 62, 1e-3),
            scaled("extreme_move_covered_fraction", 62, 67, 1e-3),
            scaled("interest_rate", 67, 72, 1e-3),
            scaled("time_to_expiration", 72, 79),
            scaled("lookahead_time", 79, 85),
            scaled("delta_scaling_factor", 85, 91, 1e-4),
            date("expiration_date", 91),
            string("underlying_commodity", 99, 109),
            string("pricing_model", 109, 111),
            scaled("coupon", 111, 119),
            string("expiration_price_flag", 119, 120),
            scaled("expiration_price", 120, 127, -1e-4),
            scaled("swap_value_factor", 128, 142),
            scaled("swap_value_factor_exponent", 142, 144, -1.0),
            scaled("base_volatility_exponent", 145, 147, -1.0),
            scaled("volatility_scan_range_exponent", 148, 150, -1.0),
            scaled("discount_factor", 151, 163, 1e-10),
            string("volatility_scan_range_quotation", 163, 164), // A absolute, P percent
            string("price_scan_range_quotation", 164, 165),
            scaled("price_scan_range_exponent", 165, 167, 1.0),
            scaled("equivalent_position_factor", 143, 157),
            integer("equivalent_position_factor_exponent", 157, 159),
            string("variable_tick", 160, 161));

    /** {@code "P "} price conversion parameters for one commodity. */
    public static final RecordSchema PRICE_CONVERSION_PARAMETERS = RecordSchema.of(
            RecordTag.of("P "), "PriceConversionParameters",
            string("exchange", 2, 5),
            string("commodity", 5, 15),
            string("contract_type", 15, 18),
            string("short_name", 18, 33),
            integer("settlement_price_decimal", 33, 36),
            integer("strike_price_decimal", 36, 39),
            string("settlement_price_alignment", 39, 40),
            string("strike_price_alignment", 40, 41),
            scaled("contract_value_factor", 41, 55, 1e-2),
            scaled("standard_cabinet_option_value", 55, 63),
            integer("futures_per_contract", 63, 65),
            string("settlement_currency_iso", 65, 68),
            string("settlement_currency_code", 68, 69),
            string("price_quotation", 69, 72),
            integer("contract_value_factor_exponent", 72, 75),
            string("exercise", 75, 79),
            string("long_name", 79, 114),
            string("positionable", 114, 115),
            string("money", 115, 116),
            string("valuation", 116, 121),
            string("settlement", 121, 126));

    /** {@code "5 "} commodity group: up to ten combined commodity codes. */
    public static final RecordSchema COMMODITY_GROUP = RecordSchema.of(
            RecordTag.of("5 "), "CommodityGroup",
            string("code", 2, 5),
            strings("commodities", 12, 72, 6));

    /** {@code "6 "} inter-commodity spread with up to four legs and a target leg. */
    public static final RecordSchema INTER_COMMODITY_SPREAD = RecordSchema.of(
            RecordTag.of("6 "), "InterCommoditySpread",
            string("commodity", 2, 5),
            integer("priority", 5, 9),
            scaled("credit_rate", 9, 16),
            string("leg1_exchange", 16, 19),
            string("leg1_required", 19, 20),
            string("leg1_commodity", 20, 26),
            scaled("leg1_ratio", 26, 33, 1e-4),
            string("leg1_side", 33, 34),
            string("leg2_exchange", 34, 37),
            string("leg2_required", 37, 38),
            string("leg2_commodity", 38, 44),
            scaled("leg2_ratio", 44, 51, 1e-4),
            string("leg2_side", 51, 52),
            string("leg3_exchange", 52, 55),
            string("leg3_required", 55, 56),
            string("leg3_commodity", 56, 62),
            scaled("leg3_ratio", 62, 69, 1e-4),
            string("leg3_side", 69, 70),
            string("leg4_exchange", 70, 73),
            string("leg4_required", 73, 74),
            string("leg4_commodity", 74, 80),
            scaled("leg4_ratio", 80, 87, 1e-4),
            string("leg4_side", 87, 88),
            string("method", 88, 90),
            string("target_exchange", 90, 93),
            string("target_required", 93, 94),
            string("target_commodity", 94, 100),
            string("group", 109, 110),
            scaled("target_delta", 110, 117, 1e-4),
            integer("minimum_legs", 117, 121));

    /** {@code "81"} first risk array line: nine scenario values plus settlement price. */
    public static final RecordSchema FIRST_RISK_ARRAY = RecordSchema.of(
            RecordTag.of("81"), "FirstRiskArray",
            string("exchange", 2, 5),
            string("commodity", 5, 15),
            string("underlying_commodity", 15, 25),
            string("contract_type", 25, 28),
            string("option_right", 28, 29),
            integer("contract_month", 29, 35),
            string("contract_day", 35, 37),
            integer("option_month", 38, 44),
            string("option_day", 44, 46),
            string("option_strike", 47, 54),
            risk("risk", 54, 108),
            scaled("settlement_price", 108, 122, 1e-12),
            string("settlement_flag", 122, 123));

    /** {@code "82"} second risk array line: seven scenario values plus deltas and volatility. */
    public static final RecordSchema SECOND_RISK_ARRAY = RecordSchema.of(
            RecordTag.of("82"), "SecondRiskArray",
            string("exchange", 2, 5),
            string("commodity", 5, 15),
            string("underlying_commodity", 15, 25),
            string("contract_type", 25, 28),
            string("option_right", 28, 29),
            integer("contract_month", 29, 35),
            string("contract_day", 35, 37),
            integer("option_month", 38, 44),
            string("option_day", 44, 46),
            string("option_strike", 47, 54),
            risk("risk", 54, 96),
            scaled("composite_delta", 96, 101, -1e-3),
            scaled("implied_volatility", 102, 110),
            scaled("settlement_price", 110, 117, -1e-6),
            string("strike_sign", 118, 119),
            scaled("current_delta", 119, 124, -1e-3),
            string("current_delta_business_day", 125, 126));

    /** {@code "S "} scanning method with up to five tiers. */
    public static final RecordSchema SCANNING_METHOD = RecordSchema.of(
            RecordTag.of("S "), "ScanningMethod",
            string("commodity", 2, 8),
            integer("code", 8, 10),
            integer("number_of_tiers", 12, 14),
            integer("tier1_starting_month", 14, 20),
            integer("tier1_ending_month", 20, 26),
            integer("tier2_starting_month", 28, 34),
            integer("tier2_ending_month", 34, 40),
            integer("tier3_starting_month", 42, 48),
            integer("tier3_ending_month", 48, 54),
            integer("tier4_starting_month", 56, 62),
            integer("tier4_ending_month", 62, 68),
            integer("tier5_starting_month", 70, 76),
            integer("tier5_ending_month", 76, 82),
            integer("weighted_futures_method", 82, 83));

    /** {@code "V "} daily adjustment rates / value maintenance rates. */
    public static final RecordSchema DAILY_ADJUSTMENTS_RATES = RecordSchema.of(
            RecordTag.of("V "), "DailyAdjustmentsRates",
            string("exchange", 2, 5),
            string("commodity", 5, 15),
            integer("month", 15, 21),
            string("day", 21, 23),
            date("business_date", 23),
            scaled("long_rate", 31, 44, -1e-6),
            string("long_discount_or_premium", 45, 46),
            scaled("short_rate", 46, 59, -1e-6),
            string("short_discount_or_premium", 60, 61),
            string("short_rate_flag", 61, 62),
            scaled("long_maintenance_rate", 62, 65, 1e-2),
            scaled("short_maintenance_rate", 65, 68, 1e-2),
            string("reset_long_margin_flag", 68, 69),
            scaled("reset_long_down_threshold", 69, 72, 1e-2),
            scaled("reset_long_up_threshold", 72, 75, 1e-2),
            string("reset_short_margin_flag", 75, 76),
            scaled("reset_short_down_threshold", 76, 79, 1e-2),
            scaled("reset_short_up_threshold", 79, 82, 1e-2),
            string("product_class", 82, 88));

    /** {@code "X "} combination margining method. */
    public static final RecordSchema COMBINATION_MARGINING_METHOD = RecordSchema.of(
            RecordTag.of("X "), "CombinationMarginingMethod",
            string("code", 2, 3),
            string("commodity", 3, 13),
            scaled("price_offset", 13, 20));

    /** {@code "Y "} option on combination product family definition. */
    public static final RecordSchema COMBINATION_PRODUCT_FAMILY = RecordSchema.of(
            RecordTag.of("Y "), "CombinationProductFamily",
            string("commodity", 2, 12),
            string("option", 12, 22));

    /** {@code "Z "} one underlying leg of a combination contract. */
    public static final RecordSchema COMBINATION_UNDERLYING_LEGS = RecordSchema.of(
            RecordTag.of("Z "), "CombinationUnderlyingLegs",
            string("exchange", 2, 5),
            string("commodity", 5, 15),
            string("combination_type", 15, 20), // STRIP, CAL or I/C
            integer("month", 20, 26),
            string("day", 26, 28),
            integer("leg_number", 35, 38),
            string("leg_relationship", 38, 39),
            string("leg_ratio_code", 39, 42),
            string("leg_commodity", 42, 52),
            string("leg_contract_type", 52, 55),
            integer("leg_contract_month", 55, 61),
            string("leg_contract_day", 61, 63),
            scaled("leg_ratio", 63, 67, 1e-4),
            string("leg_price_available", 67, 68),
            string("leg_price_usage", 68, 70),
            scaled("leg_price", 70, 77, -1e-6));

    /** {@code "E "} series-to-series intra-commodity spread with up to four legs. */
    public static final RecordSchema SERIES_INTRACOMMODITY_SPREADS = RecordSchema.of(
            RecordTag.of("E "), "SeriesIntracommoditySpreads",
            string("commodity", 2, 8),
            integer("priority", 8, 13),
            scaled("charge_rate", 13, 20),
            integer("leg1_month", 20, 24),
            string("leg1_remaining", 24, 27),
            scaled("leg1_ratio", 27, 33),
            scaled("leg1_market_side", 33, 34),
            integer("leg2_month", 34, 38),
            string("leg2_remaining", 38, 41),
            scaled("leg2_ratio", 41, 47),
            scaled("leg2_market_side", 47, 48),
            integer("leg3_month", 48, 52),
            string("leg3_remaining", 53, 55),
            scaled("leg3_ratio", 55, 61),
            scaled("leg3_market_side", 61, 62),
            integer("leg4_month", 62, 66),
            string("leg4_remaining", 66, 69),
            scaled("leg4_ratio", 70, 75),
            scaled("leg4_market_side", 75, 76));

    private static final RecordRegistry REGISTRY = RecordRegistry.builder()
            .register(EXCHANGE_COMPLEX_HEADER)
            .register(CURRENCY_CONVERSION)
            .register(EXCHANGE_HEADER)
            .register(FIRST_COMBINED_COMMODITY)
            .register(SECOND_COMBINED_COMMODITY)
            .register(REQUIRED_SPREADS)
            .register(THIRD_COMBINED_COMMODITY)
            .register(ARRAY_CALCULATION_PARAMETERS)
            .register(PRICE_CONVERSION_PARAMETERS)
            .register(COMMODITY_GROUP)
            .register(INTER_COMMODITY_SPREAD)
            .register(FIRST_RISK_ARRAY)
            .register(SECOND_RISK_ARRAY)
            .register(SERIES_INTRACOMMODITY_SPREADS)
            .register(SCANNING_METHOD)
            .register(DAILY_ADJUSTMENTS_RATES)
            .register(COMBINATION_MARGINING_METHOD)
            .register(COMBINATION_PRODUCT_FAMILY)
            .register(COMBINATION_UNDERLYING_LEGS)
            .build();

    /**
     * Returns the registry of every standard PA2 layout.
     */
    public static RecordRegistry registry() {
        return REGISTRY;
    }
}
