package com.flagship.btc_ledger.lot;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to bitcoin_lots and lot_disposals.
 *
 * Both tables are derived state: rows are written by a replay with the ids
 * the replay assigned, and only remaining_btc is ever updated afterwards.
 */
@Repository
public class LotRepository {

    private static final String LOT_COLUMNS =
        "id, created_txn_id, acquired_date, total_btc, remaining_btc, cost_basis_usd";
    private static final String DISPOSAL_COLUMNS =
        "id, lot_id, transaction_id, disposed_at, disposed_btc, disposal_basis_usd, proceeds_usd, " +
        "realized_gain_usd, holding_period, kind, reportable";
    private static final String FIFO_ORDER_BY = " ORDER BY acquired_date, created_txn_id, id";

    private final JdbcTemplate jdbcTemplate;

    public LotRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertLots(List<BitcoinLot> lots) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO bitcoin_lots (" + LOT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
            lots,
            500,
            (ps, lot) -> {
                ps.setLong(1, lot.getId());
                ps.setLong(2, lot.getCreatedTxnId());
                ps.setTimestamp(3, Timestamp.from(lot.getAcquiredDate()));
                ps.setBigDecimal(4, lot.getTotalBtc());
                ps.setBigDecimal(5, lot.getRemainingBtc());
                ps.setBigDecimal(6, lot.getCostBasisUsd());
            });
    }

    public void updateRemaining(List<BitcoinLot> lots) {
        jdbcTemplate.batchUpdate(
            "UPDATE bitcoin_lots SET remaining_btc = ? WHERE id = ?",
            lots,
            500,
            (ps, lot) -> {
                ps.setBigDecimal(1, lot.getRemainingBtc());
                ps.setLong(2, lot.getId());
            });
    }

    public void insertDisposals(List<LotDisposal> disposals) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO lot_disposals (" + DISPOSAL_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            disposals,
            500,
            (ps, disposal) -> {
                ps.setLong(1, disposal.getId());
                ps.setLong(2, disposal.getLotId());
                ps.setLong(3, disposal.getTransactionId());
                ps.setTimestamp(4, Timestamp.from(disposal.getDisposedAt()));
                ps.setBigDecimal(5, disposal.getDisposedBtc());
                ps.setBigDecimal(6, disposal.getDisposalBasisUsd());
                ps.setBigDecimal(7, disposal.getProceedsUsd());
                ps.setBigDecimal(8, disposal.getRealizedGainUsd());
                ps.setString(9, disposal.getHoldingPeriod().name());
                ps.setString(10, disposal.getKind().name());
                ps.setBoolean(11, disposal.isReportable());
            });
    }

    public List<BitcoinLot> findAllLots() {
        return jdbcTemplate.query("SELECT " + LOT_COLUMNS + " FROM bitcoin_lots" + FIFO_ORDER_BY, lotRowMapper());
    }

    public List<BitcoinLot> findOpenLots() {
        return jdbcTemplate.query(
            "SELECT " + LOT_COLUMNS + " FROM bitcoin_lots WHERE remaining_btc > 0" + FIFO_ORDER_BY,
            lotRowMapper());
    }

    public Optional<BitcoinLot> findLot(long lotId) {
        return jdbcTemplate.query(
                "SELECT " + LOT_COLUMNS + " FROM bitcoin_lots WHERE id = ?", lotRowMapper(), lotId)
            .stream()
            .findFirst();
    }

    public List<LotDisposal> findDisposalsForLot(long lotId) {
        return jdbcTemplate.query(
            "SELECT " + DISPOSAL_COLUMNS + " FROM lot_disposals WHERE lot_id = ? ORDER BY id",
            disposalRowMapper(),
            lotId);
    }

    public List<LotDisposal> findDisposals(DisposalFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + DISPOSAL_COLUMNS + " FROM lot_disposals WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (filter.getFrom() != null) {
            sql.append(" AND disposed_at >= ?");
            args.add(Timestamp.from(filter.getFrom()));
        }
        if (filter.getTo() != null) {
            sql.append(" AND disposed_at < ?");
            args.add(Timestamp.from(filter.getTo()));
        }
        if (filter.getHoldingPeriod() != null) {
            sql.append(" AND holding_period = ?");
            args.add(filter.getHoldingPeriod().name());
        }
        if (filter.isReportableOnly()) {
            sql.append(" AND reportable = TRUE");
        }
        sql.append(" ORDER BY disposed_at, id");
        return jdbcTemplate.query(sql.toString(), disposalRowMapper(), args.toArray());
    }

    private RowMapper<BitcoinLot> lotRowMapper() {
        return (rs, rowNum) -> new BitcoinLot(
            rs.getLong("id"),
            rs.getLong("created_txn_id"),
            rs.getTimestamp("acquired_date").toInstant(),
            rs.getBigDecimal("total_btc"),
            rs.getBigDecimal("remaining_btc"),
            rs.getBigDecimal("cost_basis_usd")
        );
    }

    private RowMapper<LotDisposal> disposalRowMapper() {
        return (rs, rowNum) -> LotDisposal.builder()
            .id(rs.getLong("id"))
            .lotId(rs.getLong("lot_id"))
            .transactionId(rs.getLong("transaction_id"))
            .disposedAt(rs.getTimestamp("disposed_at").toInstant())
            .disposedBtc(rs.getBigDecimal("disposed_btc"))
            .disposalBasisUsd(rs.getBigDecimal("disposal_basis_usd"))
            .proceedsUsd(rs.getBigDecimal("proceeds_usd"))
            .realizedGainUsd(rs.getBigDecimal("realized_gain_usd"))
            .holdingPeriod(HoldingPeriod.valueOf(rs.getString("holding_period")))
            .kind(DisposalKind.valueOf(rs.getString("kind")))
            .reportable(rs.getBoolean("reportable"))
            .build();
    }
}
