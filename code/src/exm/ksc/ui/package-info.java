/**
 * Command line driver for the KSC front end.
 */
package exm.ksc.ui;
