package org.indexbench.benchmarks.generator;

import org.apache.iceberg.Schema;
import org.apache.iceberg.types.Types;

/**
 * The subset of TPC-DS {@code store_sales} columns the benchmark keeps.
 */
public final class StoreSales {
    public static final String TABLE = "store_sales";

    public static final String SOLD_DATE_SK = "ss_sold_date_sk";
    public static final String ITEM_SK = "ss_item_sk";
    public static final String CUSTOMER_SK = "ss_customer_sk";
    public static final String STORE_SK = "ss_store_sk";
    public static final String TICKET_NUMBER = "ss_ticket_number";
    public static final String QUANTITY = "ss_quantity";
    public static final String SALES_PRICE = "ss_sales_price";
    public static final String NET_PROFIT = "ss_net_profit";

    public static final Schema SCHEMA = new Schema(
            Types.NestedField.optional(1, SOLD_DATE_SK, Types.IntegerType.get()),
            Types.NestedField.required(2, ITEM_SK, Types.IntegerType.get()),
            Types.NestedField.optional(3, CUSTOMER_SK, Types.IntegerType.get()),
            Types.NestedField.optional(4, STORE_SK, Types.IntegerType.get()),
            Types.NestedField.required(5, TICKET_NUMBER, Types.LongType.get()),
            Types.NestedField.optional(6, QUANTITY, Types.IntegerType.get()),
            Types.NestedField.optional(7, SALES_PRICE, Types.DoubleType.get()),
            Types.NestedField.optional(8, NET_PROFIT, Types.DoubleType.get())
    );

    private StoreSales() {
    }
}
